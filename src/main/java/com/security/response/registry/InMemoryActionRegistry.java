package com.security.response.registry;

import com.security.response.api.InvalidTransitionException;
import com.security.response.api.ProposalNotFoundException;
import com.security.response.audit.AuditLog;
import com.security.response.audit.ProposalAuditEntries;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ProposalFilter;
import com.security.response.domain.ProposalStatus;
import com.security.response.domain.RegistrationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Single-process registry for {@code response.registry.store=memory}. One lock guards the
 * proposal map, the per-target index and the audit append, so readers never see a state
 * change without its audit entry.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "response.registry.store", havingValue = "memory")
@RequiredArgsConstructor
public class InMemoryActionRegistry implements ActionRegistry {

    private final AuditLog auditLog;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ActionProposal> proposals = new LinkedHashMap<>();
    private final Map<String, String> activeByTarget = new HashMap<>();

    @Override
    public RegistrationResult register(ActionProposal candidate) {
        lock.lock();
        try {
            String existingId = activeByTarget.get(candidate.getTarget());
            ActionProposal existing = existingId != null ? proposals.get(existingId) : null;

            if (existing == null) {
                store(candidate);
                return RegistrationResult.created(candidate);
            }

            if (ProposalMerge.supersedes(candidate, existing)) {
                ActionProposal rejected = ProposalMerge.applyTransition(existing,
                        ProposalMerge.supersededBy(existing, candidate), ProposalStatus.REJECTED);
                proposals.put(rejected.getProposalId(), rejected);
                activeByTarget.remove(rejected.getTarget());
                auditLog.append(ProposalAuditEntries.transition(rejected, existing.getStatus(), ProposalMerge.SUPERSEDE_ACTOR));
                store(candidate);
                log.info("Proposal {} superseded {} for target={}", candidate.getProposalId(),
                        existing.getProposalId(), candidate.getTarget());
                return RegistrationResult.superseded(candidate, existing.getProposalId());
            }

            List<String> fresh = ProposalMerge.newReferences(existing, candidate);
            List<String> attached = new ArrayList<>(existing.getAttachedEvidence() != null
                    ? existing.getAttachedEvidence() : List.of());
            attached.addAll(fresh);
            ActionProposal updated = existing.toBuilder().attachedEvidence(List.copyOf(attached)).build();
            proposals.put(updated.getProposalId(), updated);
            auditLog.append(ProposalAuditEntries.evidenceAttached(updated, candidate, fresh));
            return RegistrationResult.duplicate(updated);
        } finally {
            lock.unlock();
        }
    }

    private void store(ActionProposal candidate) {
        proposals.put(candidate.getProposalId(), candidate);
        activeByTarget.put(candidate.getTarget(), candidate.getProposalId());
        auditLog.append(ProposalAuditEntries.created(candidate));
    }

    @Override
    public ActionProposal transition(String proposalId, ProposalStatus expected, ProposalStatus next, String actor,
                                     UnaryOperator<ActionProposal> mutation) {
        lock.lock();
        try {
            ActionProposal current = proposals.get(proposalId);
            if (current == null) {
                throw new ProposalNotFoundException(proposalId);
            }
            if (current.getStatus() != expected || !expected.canTransitionTo(next)) {
                throw new InvalidTransitionException(proposalId, current.getStatus(), expected, next);
            }
            ActionProposal mutated = mutation != null ? mutation.apply(current) : current;
            ActionProposal updated = ProposalMerge.applyTransition(current, mutated, next);
            proposals.put(proposalId, updated);
            if (!next.isActive()) {
                activeByTarget.remove(updated.getTarget(), proposalId);
            }
            auditLog.append(ProposalAuditEntries.transition(updated, expected, actor));
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ActionProposal> findById(String proposalId) {
        lock.lock();
        try {
            return Optional.ofNullable(proposals.get(proposalId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ActionProposal> findActiveByTarget(String target) {
        lock.lock();
        try {
            String id = activeByTarget.get(target);
            return id != null ? Optional.ofNullable(proposals.get(id)) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ActionProposal> find(ProposalFilter filter) {
        List<ActionProposal> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(proposals.values());
        } finally {
            lock.unlock();
        }
        ProposalFilter f = filter != null ? filter : ProposalFilter.all();
        return snapshot.stream()
                .filter(f::matches)
                .sorted(Comparator.comparing(ActionProposal::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .collect(Collectors.toList());
    }
}
