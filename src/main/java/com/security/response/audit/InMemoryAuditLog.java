package com.security.response.audit;

import com.security.response.domain.AuditEntry;
import com.security.response.domain.AuditEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Process-local audit log for {@code response.registry.store=memory}. Lost on restart.
 */
@Component
@ConditionalOnProperty(name = "response.registry.store", havingValue = "memory")
@RequiredArgsConstructor
public class InMemoryAuditLog implements AuditLog {

    private final ComplianceAuditLogger auditLogger;

    private final List<AuditEntry> entries = new ArrayList<>();
    private long nextSequence = 1;

    @Override
    public synchronized AuditEntry append(AuditEntry entry) {
        AuditEntry stored = entry.toBuilder()
                .sequence(nextSequence++)
                .timestamp(entry.getTimestamp() != null ? entry.getTimestamp() : Instant.now())
                .build();
        entries.add(stored);
        auditLogger.log(stored);
        return stored;
    }

    @Override
    public synchronized List<AuditEntry> findAll() {
        return List.copyOf(entries);
    }

    @Override
    public synchronized List<AuditEntry> findByProposalId(String proposalId) {
        return entries.stream()
                .filter(e -> proposalId.equals(e.getProposalId()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<AuditEntry> findLatestConfigChange() {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).getEventType() == AuditEventType.CONFIG_CHANGE) {
                return Optional.of(entries.get(i));
            }
        }
        return Optional.empty();
    }
}
