package com.security.response.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per target that currently has an active proposal. The primary key on
 * {@code target} makes a second concurrent insert for the same target fail.
 */
@Entity
@Table(name = "active_targets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveTargetEntity {

    @Id
    @Column(name = "target", nullable = false)
    private String target;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "proposal_id", nullable = false)
    private String proposalId;

    @Column(name = "since", nullable = false)
    private Instant since;
}
