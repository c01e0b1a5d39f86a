package com.security.response.audit;

import com.security.response.domain.ActionProposal;
import com.security.response.domain.AuditEntry;
import com.security.response.domain.AuditEventType;
import com.security.response.domain.EngineConfig;
import com.security.response.domain.ProposalStatus;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Builders for the audit entries the registries and config service write.
 */
public final class ProposalAuditEntries {

    private ProposalAuditEntries() {
    }

    public static AuditEntry created(ActionProposal proposal) {
        return AuditEntry.builder()
                .timestamp(Instant.now())
                .eventType(AuditEventType.PROPOSAL_CREATED)
                .actor(proposal.getCreatedBy())
                .proposalId(proposal.getProposalId())
                .target(proposal.getTarget())
                .actionType(proposal.getActionType())
                .toStatus(proposal.getStatus())
                .detail(String.format(Locale.ROOT, "confidence=%.2f requiresApproval=%s", proposal.getConfidence(),
                        proposal.isRequiresApproval()))
                .build();
    }

    public static AuditEntry transition(ActionProposal updated, ProposalStatus from, String actor) {
        return AuditEntry.builder()
                .timestamp(Instant.now())
                .eventType(AuditEventType.PROPOSAL_TRANSITION)
                .actor(actor)
                .proposalId(updated.getProposalId())
                .target(updated.getTarget())
                .actionType(updated.getActionType())
                .fromStatus(from)
                .toStatus(updated.getStatus())
                .detail(transitionDetail(updated))
                .build();
    }

    public static AuditEntry evidenceAttached(ActionProposal existing, ActionProposal duplicate, List<String> attached) {
        return AuditEntry.builder()
                .timestamp(Instant.now())
                .eventType(AuditEventType.EVIDENCE_ATTACHED)
                .actor(duplicate.getCreatedBy())
                .proposalId(existing.getProposalId())
                .target(existing.getTarget())
                .actionType(existing.getActionType())
                .fromStatus(existing.getStatus())
                .toStatus(existing.getStatus())
                .detail(String.format(Locale.ROOT, "duplicate %s (confidence=%.2f) attached %s", duplicate.getProposalId(),
                        duplicate.getConfidence(), attached))
                .build();
    }

    public static AuditEntry configChange(EngineConfig before, EngineConfig after, String actor) {
        return AuditEntry.builder()
                .timestamp(Instant.now())
                .eventType(AuditEventType.CONFIG_CHANGE)
                .actor(actor)
                .configBefore(before)
                .configAfter(after)
                .build();
    }

    private static String transitionDetail(ActionProposal p) {
        switch (p.getStatus()) {
            case REJECTED:
                return p.getSupersededBy() != null
                        ? "superseded by " + p.getSupersededBy() + ": " + p.getRejectionReason()
                        : p.getRejectionReason();
            case EXECUTED:
                return p.getResult() != null ? p.getResult().getDetail() : null;
            case FAILED:
                return p.getResult() != null ? p.getResult().getError() : null;
            default:
                return null;
        }
    }
}
