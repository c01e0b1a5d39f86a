package com.security.response.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Candidate containment action and its lifecycle state. Instances are immutable;
 * the registry replaces them on every transition. {@code confidence}, {@code evidence},
 * {@code reason}, {@code actionType} and {@code target} never change after creation.
 */
@Value
@Builder(toBuilder = true)
public class ActionProposal {

    String proposalId;
    ActionType actionType;
    /** IP, hostname, username or domain. Dedup key for active proposals. */
    String target;
    String title;
    /** 0.0–1.0, computed once at creation. */
    double confidence;
    /** References (alert / finding ids) that justified the confidence. Never empty. */
    List<String> evidence;
    /** References attached later by duplicate proposals for the same target. Append-only. */
    List<String> attachedEvidence;
    String reason;
    /** Producer: agent name, rule id or human. */
    String createdBy;
    Instant createdAt;
    ProposalStatus status;
    /** Approval Gate outcome at creation; never recomputed. */
    boolean requiresApproval;
    Map<String, String> parameters;

    String decidedBy;
    Instant decidedAt;
    String rejectionReason;
    /** Set when a pending proposal was replaced by a higher-confidence one. */
    String supersededBy;

    Instant executionStartedAt;
    ExecutionResult result;

    public boolean isActive() {
        return status != null && status.isActive();
    }
}
