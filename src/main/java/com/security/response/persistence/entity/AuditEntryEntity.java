package com.security.response.persistence.entity;

import com.security.response.domain.ActionType;
import com.security.response.domain.AuditEventType;
import com.security.response.domain.ProposalStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Insert-only audit row. The generated id is the entry's sequence number.
 */
@Entity
@Immutable
@Table(name = "audit_entries", indexes = {
    @Index(name = "idx_audit_proposal_id", columnList = "proposal_id"),
    @Index(name = "idx_audit_event_type", columnList = "event_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "seq")
    private Long sequence;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private AuditEventType eventType;

    @Column(name = "actor")
    private String actor;

    @Column(name = "proposal_id")
    private String proposalId;

    @Column(name = "target")
    private String target;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type")
    private ActionType actionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status")
    private ProposalStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status")
    private ProposalStatus toStatus;

    @Column(name = "before_auto_approve_threshold")
    private Double beforeAutoApproveThreshold;

    @Column(name = "before_review_threshold")
    private Double beforeReviewThreshold;

    @Column(name = "before_force_manual_approval")
    private Boolean beforeForceManualApproval;

    @Column(name = "after_auto_approve_threshold")
    private Double afterAutoApproveThreshold;

    @Column(name = "after_review_threshold")
    private Double afterReviewThreshold;

    @Column(name = "after_force_manual_approval")
    private Boolean afterForceManualApproval;

    @Column(name = "detail", length = 2000)
    private String detail;
}
