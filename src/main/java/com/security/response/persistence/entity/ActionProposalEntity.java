package com.security.response.persistence.entity;

import com.security.response.domain.ActionType;
import com.security.response.domain.ProposalStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persistent entity for action proposals. Rows are never deleted; terminal proposals stay
 * for reporting and audit.
 */
@Entity
@Table(name = "action_proposals", indexes = {
    @Index(name = "idx_proposal_target", columnList = "target"),
    @Index(name = "idx_proposal_status", columnList = "status"),
    @Index(name = "idx_proposal_created_at", columnList = "created_at"),
    @Index(name = "idx_proposal_action_type", columnList = "action_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionProposalEntity {

    @Id
    @Column(name = "proposal_id", nullable = false)
    private String proposalId;

    @Version
    @Column(name = "version")
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false)
    private ActionType actionType;

    @Column(name = "target", nullable = false)
    private String target;

    @Column(name = "title")
    private String title;

    @Column(name = "confidence", nullable = false, updatable = false)
    private double confidence;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "action_proposal_evidence", joinColumns = @JoinColumn(name = "proposal_id"))
    @OrderColumn(name = "evidence_order")
    @Column(name = "reference", nullable = false)
    @Builder.Default
    private List<String> evidence = new ArrayList<>();

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "action_proposal_attached_evidence", joinColumns = @JoinColumn(name = "proposal_id"))
    @OrderColumn(name = "evidence_order")
    @Column(name = "reference", nullable = false)
    @Builder.Default
    private List<String> attachedEvidence = new ArrayList<>();

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ProposalStatus status;

    @Column(name = "requires_approval", nullable = false)
    private boolean requiresApproval;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "action_proposal_parameters", joinColumns = @JoinColumn(name = "proposal_id"))
    @MapKeyColumn(name = "param_key")
    @Column(name = "param_value", length = 1000)
    @Builder.Default
    private Map<String, String> parameters = new LinkedHashMap<>();

    @Column(name = "decided_by")
    private String decidedBy;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "rejection_reason", length = 1000)
    private String rejectionReason;

    @Column(name = "superseded_by")
    private String supersededBy;

    @Column(name = "execution_started_at")
    private Instant executionStartedAt;

    @Column(name = "result_success")
    private Boolean resultSuccess;

    @Column(name = "result_detail", length = 1000)
    private String resultDetail;

    @Column(name = "result_error", length = 1000)
    private String resultError;

    @Column(name = "result_already_in_desired_state")
    private Boolean resultAlreadyInDesiredState;

    @Column(name = "result_executor_name")
    private String resultExecutorName;

    @Column(name = "result_timestamp")
    private Instant resultTimestamp;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
