package com.security.response.core;

import com.security.response.api.DuplicateTargetException;
import com.security.response.api.InvalidTransitionException;
import com.security.response.api.ProposalNotFoundException;
import com.security.response.audit.AuditLog;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ActionType;
import com.security.response.domain.ApprovalDecision;
import com.security.response.domain.AuditEntry;
import com.security.response.domain.CorrelationResult;
import com.security.response.domain.EngineConfig;
import com.security.response.domain.ProposalDraft;
import com.security.response.domain.ProposalFilter;
import com.security.response.domain.ProposalStats;
import com.security.response.domain.ProposalStatus;
import com.security.response.domain.RegistrationResult;
import com.security.response.domain.ResponseDecision;
import com.security.response.messaging.ActionEventProducer;
import com.security.response.registry.ActionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Proposal lifecycle entry points: creation through the Approval Gate, human approve/reject,
 * and operator queries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalService {

    private final ActionRegistry registry;
    private final ApprovalGate approvalGate;
    private final ProposalFactory proposalFactory;
    private final EngineConfigService configService;
    private final AuditLog auditLog;
    private final ActionEventProducer eventProducer;

    /**
     * Submit a proposal from an external producer (reasoning agent, analyst, rule).
     *
     * @throws DuplicateTargetException the target has an active proposal that this one does not outrank
     */
    public ResponseDecision submit(ProposalDraft draft) {
        return propose(draft, null);
    }

    /**
     * Gate and register a draft. The config is read once, here, so a concurrent config change
     * applies either fully or not at all to this proposal.
     */
    public ResponseDecision propose(ProposalDraft draft, CorrelationResult correlation) {
        proposalFactory.validateForGate(draft);
        EngineConfig config = configService.current();
        ApprovalDecision decision = approvalGate.decide(draft.getConfidence(), config);

        if (!decision.createsProposal()) {
            String message = String.format(Locale.ROOT, "Confidence %.2f below review threshold %.2f for %s; monitor only",
                    draft.getConfidence(), config.getReviewThreshold(), draft.getTarget());
            log.info("Monitor only: target={}, actionType={}, confidence={}, createdBy={}",
                    draft.getTarget(), draft.getActionType(), draft.getConfidence(), draft.getCreatedBy());
            return ResponseDecision.builder()
                    .outcome(ResponseDecision.Outcome.MONITOR_ONLY)
                    .target(draft.getTarget())
                    .correlation(correlation)
                    .message(message)
                    .build();
        }

        ActionProposal candidate = proposalFactory.create(draft, decision);
        RegistrationResult result = register(candidate);
        ActionProposal stored = result.getProposal();

        switch (result.getOutcome()) {
            case DUPLICATE:
                log.info("Duplicate proposal for target={} (confidence={}); evidence attached to active proposal {}",
                        candidate.getTarget(), candidate.getConfidence(), stored.getProposalId());
                eventProducer.publishEvidenceAttached(stored, candidate.getCreatedBy());
                throw new DuplicateTargetException(candidate.getTarget(), stored.getProposalId());
            case SUPERSEDED:
                registry.findById(result.getSupersededProposalId())
                        .ifPresent(old -> eventProducer.publishStatus(old, old.getDecidedBy()));
                break;
            default:
                break;
        }
        eventProducer.publishCreated(stored);
        log.info("Proposal {}: proposalId={}, target={}, actionType={}, confidence={}, status={}, requiresApproval={}",
                result.getOutcome(), stored.getProposalId(), stored.getTarget(), stored.getActionType(),
                stored.getConfidence(), stored.getStatus(), stored.isRequiresApproval());

        return ResponseDecision.builder()
                .outcome(result.getOutcome() == RegistrationResult.Outcome.SUPERSEDED
                        ? ResponseDecision.Outcome.SUPERSEDED : ResponseDecision.Outcome.CREATED)
                .target(stored.getTarget())
                .proposal(stored)
                .supersededProposalId(result.getSupersededProposalId())
                .correlation(correlation)
                .message(stored.isRequiresApproval() ? "Proposal awaiting human approval" : "Proposal auto-approved")
                .build();
    }

    /**
     * Two concurrent first proposals for a target collide on the active-target key;
     * the loser retries once and then sees the winner's proposal.
     */
    private RegistrationResult register(ActionProposal candidate) {
        try {
            return registry.register(candidate);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent registration for target={}; retrying against the current active proposal",
                    candidate.getTarget());
            return registry.register(candidate);
        }
    }

    /**
     * @throws InvalidTransitionException the proposal is no longer PENDING (including a lost race)
     */
    public ActionProposal approve(String proposalId, String actor) {
        requireActor(actor);
        ActionProposal approved = registry.transition(proposalId, ProposalStatus.PENDING, ProposalStatus.APPROVED, actor,
                p -> p.toBuilder().decidedBy(actor).decidedAt(Instant.now()).build());
        log.info("Proposal approved: proposalId={}, target={}, actor={}", proposalId, approved.getTarget(), actor);
        eventProducer.publishStatus(approved, actor);
        return approved;
    }

    /**
     * @throws InvalidTransitionException the proposal is no longer PENDING (including a lost race)
     */
    public ActionProposal reject(String proposalId, String actor, String reason) {
        requireActor(actor);
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason is required to reject a proposal");
        }
        ActionProposal rejected = registry.transition(proposalId, ProposalStatus.PENDING, ProposalStatus.REJECTED, actor,
                p -> p.toBuilder().decidedBy(actor).decidedAt(Instant.now()).rejectionReason(reason).build());
        log.info("Proposal rejected: proposalId={}, target={}, actor={}, reason={}", proposalId, rejected.getTarget(), actor, reason);
        eventProducer.publishStatus(rejected, actor);
        return rejected;
    }

    public ActionProposal get(String proposalId) {
        return registry.findById(proposalId).orElseThrow(() -> new ProposalNotFoundException(proposalId));
    }

    public List<ActionProposal> list(ProposalFilter filter) {
        return registry.find(filter);
    }

    public long pendingCount() {
        return registry.find(ProposalFilter.byStatus(ProposalStatus.PENDING)).size();
    }

    public ProposalStats stats() {
        List<ActionProposal> all = registry.find(ProposalFilter.all());
        Map<ProposalStatus, Long> byStatus = new EnumMap<>(ProposalStatus.class);
        for (ProposalStatus status : ProposalStatus.values()) {
            byStatus.put(status, 0L);
        }
        Map<ActionType, Long> byActionType = new EnumMap<>(ActionType.class);
        long requiresApproval = 0;
        for (ActionProposal p : all) {
            byStatus.merge(p.getStatus(), 1L, Long::sum);
            byActionType.merge(p.getActionType(), 1L, Long::sum);
            if (p.isRequiresApproval()) {
                requiresApproval++;
            }
        }
        return ProposalStats.builder()
                .total(all.size())
                .byStatus(byStatus)
                .byActionType(byActionType)
                .requiresApproval(requiresApproval)
                .build();
    }

    /** Audit trail for one proposal, or the whole log when {@code proposalId} is null. */
    public List<AuditEntry> auditTrail(String proposalId) {
        if (proposalId == null || proposalId.isBlank()) {
            return auditLog.findAll();
        }
        return auditLog.findByProposalId(proposalId);
    }

    private static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor is required");
        }
    }
}
