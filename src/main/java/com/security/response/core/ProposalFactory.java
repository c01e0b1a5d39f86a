package com.security.response.core;

import com.security.response.api.InsufficientEvidenceException;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ApprovalDecision;
import com.security.response.domain.CorrelationFactor;
import com.security.response.domain.CorrelationResult;
import com.security.response.domain.ProposalDraft;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds immutable proposals from drafts, and drafts from correlation results.
 */
@Component
public class ProposalFactory {

    /**
     * Checks the fields the Approval Gate needs. Evidence and reason are checked only when a
     * proposal is actually built, so a low-confidence draft still yields monitor-only.
     */
    public void validateForGate(ProposalDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("proposal draft is required");
        }
        if (draft.getActionType() == null) {
            throw new IllegalArgumentException("actionType is required");
        }
        if (isBlank(draft.getTarget())) {
            throw new IllegalArgumentException("target is required");
        }
        double confidence = draft.getConfidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0.0, 1.0], was " + confidence);
        }
    }

    /**
     * Validate a draft without building a proposal.
     *
     * @throws InsufficientEvidenceException empty evidence
     * @throws IllegalArgumentException      any other missing or out-of-range field
     */
    public void validate(ProposalDraft draft) {
        validateForGate(draft);
        if (draft.getEvidence() == null || draft.getEvidence().stream().allMatch(ProposalFactory::isBlank)) {
            throw new InsufficientEvidenceException(draft.getTarget(),
                    "Proposal for " + draft.getTarget() + " has no evidence references");
        }
        if (isBlank(draft.getReason())) {
            throw new IllegalArgumentException("reason is required");
        }
        if (isBlank(draft.getCreatedBy())) {
            throw new IllegalArgumentException("createdBy is required");
        }
    }

    /**
     * Build a proposal in the initial status chosen by the gate.
     */
    public ActionProposal create(ProposalDraft draft, ApprovalDecision decision) {
        validate(draft);
        if (!decision.createsProposal()) {
            throw new IllegalStateException("Approval decision " + decision + " does not create a proposal");
        }
        List<String> evidence = draft.getEvidence().stream()
                .filter(ref -> !isBlank(ref))
                .map(String::trim)
                .collect(Collectors.toCollection(LinkedHashSet::new))
                .stream()
                .collect(Collectors.toUnmodifiableList());
        Map<String, String> parameters = new LinkedHashMap<>();
        if (draft.getParameters() != null) {
            draft.getParameters().forEach((k, v) -> {
                if (k != null && v != null) {
                    parameters.put(k, v);
                }
            });
        }
        String target = draft.getTarget().trim();
        return ActionProposal.builder()
                .proposalId(UUID.randomUUID().toString())
                .actionType(draft.getActionType())
                .target(target)
                .title(isBlank(draft.getTitle()) ? draft.getActionType().getDisplayName() + ": " + target : draft.getTitle())
                .confidence(draft.getConfidence())
                .evidence(evidence)
                .attachedEvidence(List.of())
                .reason(draft.getReason())
                .createdBy(draft.getCreatedBy())
                .createdAt(Instant.now())
                .status(decision.getInitialStatus())
                .requiresApproval(decision.requiresApproval())
                .parameters(Collections.unmodifiableMap(parameters))
                .build();
    }

    /** "Correlated 2 alert(s) for 10.0.0.5: multi_source (+0.20); ransomware (+0.25) = confidence 0.45" */
    static String buildReason(String target, CorrelationResult correlation) {
        List<String> parts = new ArrayList<>();
        for (CorrelationFactor factor : correlation.getFactors()) {
            parts.add(factor.toString());
        }
        return String.format(Locale.ROOT, "Correlated %d alert(s) for %s: %s = confidence %.2f",
                correlation.getAlertCount(), target, String.join("; ", parts), correlation.getConfidence());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
