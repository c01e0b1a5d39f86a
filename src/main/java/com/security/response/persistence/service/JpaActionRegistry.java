package com.security.response.persistence.service;

import com.security.response.api.InvalidTransitionException;
import com.security.response.api.ProposalNotFoundException;
import com.security.response.audit.AuditLog;
import com.security.response.audit.ProposalAuditEntries;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ProposalFilter;
import com.security.response.domain.ProposalStatus;
import com.security.response.domain.RegistrationResult;
import com.security.response.persistence.entity.ActionProposalEntity;
import com.security.response.persistence.entity.ActiveTargetEntity;
import com.security.response.persistence.repository.ActionProposalRepository;
import com.security.response.persistence.repository.ActiveTargetRepository;
import com.security.response.persistence.repository.ProposalSpecifications;
import com.security.response.registry.ActionRegistry;
import com.security.response.registry.ProposalMerge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Database-backed registry (default). Status changes lock the proposal row
 * ({@code SELECT ... FOR UPDATE}); the one-active-per-target rule is enforced by the
 * {@code active_targets} primary key. A concurrent first proposal for the same target fails
 * with {@link org.springframework.dao.DataIntegrityViolationException}; the caller retries.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "response.registry.store", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
public class JpaActionRegistry implements ActionRegistry {

    private final ActionProposalRepository proposalRepository;
    private final ActiveTargetRepository activeTargetRepository;
    private final AuditLog auditLog;

    @Override
    @Transactional
    public RegistrationResult register(ActionProposal candidate) {
        Optional<ActiveTargetEntity> slot = activeTargetRepository.findByTargetForUpdate(candidate.getTarget());
        if (slot.isEmpty()) {
            activeTargetRepository.saveAndFlush(ActiveTargetEntity.builder()
                    .target(candidate.getTarget())
                    .proposalId(candidate.getProposalId())
                    .since(Instant.now())
                    .build());
            store(candidate);
            return RegistrationResult.created(candidate);
        }

        ActiveTargetEntity activeTarget = slot.get();
        ActionProposalEntity existingEntity = proposalRepository.findByIdForUpdate(activeTarget.getProposalId())
                .orElseThrow(() -> new IllegalStateException("active_targets points at missing proposal "
                        + activeTarget.getProposalId()));
        ActionProposal existing = ProposalEntityMapper.toDomain(existingEntity);

        if (ProposalMerge.supersedes(candidate, existing)) {
            ActionProposal rejected = ProposalMerge.applyTransition(existing,
                    ProposalMerge.supersededBy(existing, candidate), ProposalStatus.REJECTED);
            ProposalEntityMapper.applyLifecycle(existingEntity, rejected);
            proposalRepository.save(existingEntity);
            auditLog.append(ProposalAuditEntries.transition(rejected, existing.getStatus(), ProposalMerge.SUPERSEDE_ACTOR));

            activeTarget.setProposalId(candidate.getProposalId());
            activeTarget.setSince(Instant.now());
            activeTargetRepository.save(activeTarget);
            store(candidate);
            log.info("Proposal {} superseded {} for target={}", candidate.getProposalId(),
                    existing.getProposalId(), candidate.getTarget());
            return RegistrationResult.superseded(candidate, existing.getProposalId());
        }

        List<String> fresh = ProposalMerge.newReferences(existing, candidate);
        existingEntity.getAttachedEvidence().addAll(fresh);
        proposalRepository.save(existingEntity);
        ActionProposal updated = ProposalEntityMapper.toDomain(existingEntity);
        auditLog.append(ProposalAuditEntries.evidenceAttached(updated, candidate, fresh));
        return RegistrationResult.duplicate(updated);
    }

    private void store(ActionProposal candidate) {
        proposalRepository.save(ProposalEntityMapper.toEntity(candidate));
        auditLog.append(ProposalAuditEntries.created(candidate));
    }

    @Override
    @Transactional
    public ActionProposal transition(String proposalId, ProposalStatus expected, ProposalStatus next, String actor,
                                     UnaryOperator<ActionProposal> mutation) {
        ActionProposalEntity entity = proposalRepository.findByIdForUpdate(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException(proposalId));
        if (entity.getStatus() != expected || !expected.canTransitionTo(next)) {
            throw new InvalidTransitionException(proposalId, entity.getStatus(), expected, next);
        }
        ActionProposal current = ProposalEntityMapper.toDomain(entity);
        ActionProposal mutated = mutation != null ? mutation.apply(current) : current;
        ActionProposal updated = ProposalMerge.applyTransition(current, mutated, next);
        ProposalEntityMapper.applyLifecycle(entity, updated);
        proposalRepository.save(entity);

        if (!next.isActive()) {
            activeTargetRepository.findByTargetForUpdate(updated.getTarget())
                    .filter(t -> proposalId.equals(t.getProposalId()))
                    .ifPresent(activeTargetRepository::delete);
        }
        auditLog.append(ProposalAuditEntries.transition(updated, expected, actor));
        return updated;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ActionProposal> findById(String proposalId) {
        return proposalRepository.findById(proposalId).map(ProposalEntityMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ActionProposal> findActiveByTarget(String target) {
        return activeTargetRepository.findById(target)
                .flatMap(t -> proposalRepository.findById(t.getProposalId()))
                .map(ProposalEntityMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ActionProposal> find(ProposalFilter filter) {
        ProposalFilter f = filter != null ? filter : ProposalFilter.all();
        return proposalRepository.findAll(ProposalSpecifications.matching(f), Sort.by(Sort.Direction.DESC, "createdAt"))
                .stream()
                .map(ProposalEntityMapper::toDomain)
                .collect(Collectors.toList());
    }
}
