package com.security.response.core;

import com.security.response.api.InsufficientEvidenceException;
import com.security.response.correlation.Correlator;
import com.security.response.domain.ActionType;
import com.security.response.domain.CorrelationResult;
import com.security.response.domain.ProposalDraft;
import com.security.response.domain.ResponseDecision;
import com.security.response.evidence.EvidenceBundle;
import com.security.response.evidence.EvidenceGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Automated path from a target to a decision: gather evidence, correlate, gate, register.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseOrchestrator {

    private final EvidenceGateway evidenceGateway;
    private final Correlator correlator;
    private final ProposalService proposalService;

    public ResponseDecision correlateAndPropose(String target, ActionType actionType, String createdBy) {
        return correlateAndPropose(target, actionType, createdBy, null);
    }

    /**
     * Run one correlation cycle for the target.
     *
     * @param deadline overall budget for evidence gathering; null uses the configured default
     * @throws InsufficientEvidenceException no source returned any alert before the deadline
     * @throws com.security.response.api.DuplicateTargetException an active proposal already covers the target
     */
    public ResponseDecision correlateAndPropose(String rawTarget, ActionType actionType, String createdBy,
                                                Duration deadline) {
        if (rawTarget == null || rawTarget.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        String target = rawTarget.trim();
        if (actionType == null) {
            throw new IllegalArgumentException("actionType is required");
        }
        EvidenceBundle bundle = evidenceGateway.gather(target, deadline);
        CorrelationResult correlation = correlator.correlate(bundle.getAlerts(), bundle.getFailedSources());
        log.info("Correlated target={}: alerts={}, confidence={}, factors={}, failedSources={}",
                target, correlation.getAlertCount(), correlation.getConfidence(), correlation.getFactors(),
                correlation.getFailedSources().keySet());

        if (!correlation.hasAlerts()) {
            throw new InsufficientEvidenceException(target, bundle.getFailedSources().isEmpty()
                    ? "No alerts found for " + target + "; monitor only"
                    : "No alerts gathered for " + target + " (failed sources: " + bundle.getFailedSources().keySet() + "); monitor only");
        }

        ProposalDraft draft = ProposalDraft.builder()
                .actionType(actionType)
                .target(target)
                .confidence(correlation.getConfidence())
                .evidence(correlation.getEvidence())
                .reason(ProposalFactory.buildReason(target, correlation))
                .createdBy(createdBy)
                .build();
        return proposalService.propose(draft, correlation);
    }
}
