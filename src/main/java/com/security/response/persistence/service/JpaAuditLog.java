package com.security.response.persistence.service;

import com.security.response.audit.AuditLog;
import com.security.response.audit.ComplianceAuditLogger;
import com.security.response.domain.AuditEntry;
import com.security.response.domain.AuditEventType;
import com.security.response.domain.EngineConfig;
import com.security.response.persistence.entity.AuditEntryEntity;
import com.security.response.persistence.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Audit log backed by the {@code audit_entries} table. {@link #append} joins the caller's
 * transaction, so an entry commits or rolls back together with the state change it records.
 */
@Service
@ConditionalOnProperty(name = "response.registry.store", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
public class JpaAuditLog implements AuditLog {

    private final AuditEntryRepository repository;
    private final ComplianceAuditLogger auditLogger;

    @Override
    @Transactional
    public AuditEntry append(AuditEntry entry) {
        EngineConfig before = entry.getConfigBefore();
        EngineConfig after = entry.getConfigAfter();
        AuditEntryEntity saved = repository.save(AuditEntryEntity.builder()
                .recordedAt(entry.getTimestamp() != null ? entry.getTimestamp() : Instant.now())
                .eventType(entry.getEventType())
                .actor(entry.getActor())
                .proposalId(entry.getProposalId())
                .target(entry.getTarget())
                .actionType(entry.getActionType())
                .fromStatus(entry.getFromStatus())
                .toStatus(entry.getToStatus())
                .beforeAutoApproveThreshold(before != null ? before.getAutoApproveThreshold() : null)
                .beforeReviewThreshold(before != null ? before.getReviewThreshold() : null)
                .beforeForceManualApproval(before != null ? before.isForceManualApproval() : null)
                .afterAutoApproveThreshold(after != null ? after.getAutoApproveThreshold() : null)
                .afterReviewThreshold(after != null ? after.getReviewThreshold() : null)
                .afterForceManualApproval(after != null ? after.isForceManualApproval() : null)
                .detail(truncate(entry.getDetail()))
                .build());
        AuditEntry stored = toDomain(saved);
        auditLogger.log(stored);
        return stored;
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEntry> findAll() {
        return repository.findAllByOrderBySequenceAsc().stream()
                .map(JpaAuditLog::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEntry> findByProposalId(String proposalId) {
        return repository.findByProposalIdOrderBySequenceAsc(proposalId).stream()
                .map(JpaAuditLog::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuditEntry> findLatestConfigChange() {
        return repository.findFirstByEventTypeOrderBySequenceDesc(AuditEventType.CONFIG_CHANGE)
                .map(JpaAuditLog::toDomain);
    }

    private static AuditEntry toDomain(AuditEntryEntity e) {
        return AuditEntry.builder()
                .sequence(e.getSequence())
                .timestamp(e.getRecordedAt())
                .eventType(e.getEventType())
                .actor(e.getActor())
                .proposalId(e.getProposalId())
                .target(e.getTarget())
                .actionType(e.getActionType())
                .fromStatus(e.getFromStatus())
                .toStatus(e.getToStatus())
                .configBefore(config(e.getBeforeAutoApproveThreshold(), e.getBeforeReviewThreshold(), e.getBeforeForceManualApproval()))
                .configAfter(config(e.getAfterAutoApproveThreshold(), e.getAfterReviewThreshold(), e.getAfterForceManualApproval()))
                .detail(e.getDetail())
                .build();
    }

    private static EngineConfig config(Double autoApprove, Double review, Boolean forceManual) {
        if (autoApprove == null || review == null) {
            return null;
        }
        return EngineConfig.builder()
                .autoApproveThreshold(autoApprove)
                .reviewThreshold(review)
                .forceManualApproval(Boolean.TRUE.equals(forceManual))
                .build();
    }

    private static String truncate(String detail) {
        return detail != null && detail.length() > 2000 ? detail.substring(0, 2000) : detail;
    }
}
