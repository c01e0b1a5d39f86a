package com.security.response.registry;

import com.security.response.domain.ActionProposal;
import com.security.response.domain.ProposalStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Conflict rules shared by the registry implementations.
 */
public final class ProposalMerge {

    public static final String SUPERSEDE_ACTOR = "system:supersede";

    private ProposalMerge() {
    }

    /** A PENDING proposal is replaced only by a strictly more confident one. */
    public static boolean supersedes(ActionProposal candidate, ActionProposal existing) {
        return existing.getStatus() == ProposalStatus.PENDING
                && candidate.getConfidence() > existing.getConfidence();
    }

    /** Rejection of {@code existing} in favour of {@code candidate}. */
    public static ActionProposal supersededBy(ActionProposal existing, ActionProposal candidate) {
        return existing.toBuilder()
                .decidedBy(SUPERSEDE_ACTOR)
                .decidedAt(Instant.now())
                .supersededBy(candidate.getProposalId())
                .rejectionReason(String.format(Locale.ROOT, "Superseded by higher-confidence proposal (%.2f > %.2f)",
                        candidate.getConfidence(), existing.getConfidence()))
                .build();
    }

    /** References from the duplicate that the existing proposal does not carry yet. */
    public static List<String> newReferences(ActionProposal existing, ActionProposal duplicate) {
        Set<String> known = new LinkedHashSet<>(existing.getEvidence());
        if (existing.getAttachedEvidence() != null) {
            known.addAll(existing.getAttachedEvidence());
        }
        List<String> fresh = new ArrayList<>();
        for (String ref : duplicate.getEvidence()) {
            if (known.add(ref)) {
                fresh.add(ref);
            }
        }
        return fresh;
    }

    /**
     * Copy of {@code mutated} with the fields that are write-once taken from {@code stored}
     * and the status set to {@code next}.
     */
    public static ActionProposal applyTransition(ActionProposal stored, ActionProposal mutated, ProposalStatus next) {
        return mutated.toBuilder()
                .proposalId(stored.getProposalId())
                .actionType(stored.getActionType())
                .target(stored.getTarget())
                .title(stored.getTitle())
                .confidence(stored.getConfidence())
                .evidence(stored.getEvidence())
                .attachedEvidence(stored.getAttachedEvidence())
                .reason(stored.getReason())
                .createdBy(stored.getCreatedBy())
                .createdAt(stored.getCreatedAt())
                .requiresApproval(stored.isRequiresApproval())
                .parameters(stored.getParameters())
                .status(next)
                .build();
    }
}
