package com.security.response.audit;

import com.security.response.domain.AuditEntry;

import java.util.List;
import java.util.Optional;

/**
 * Append-only record of every proposal creation, status transition and config change.
 * Entries are never updated or deleted.
 */
public interface AuditLog {

    /**
     * Append an entry. Callers that change proposal state append inside the same lock or
     * transaction as the change, so the state change and its entry are never seen apart.
     *
     * @return the stored entry with its sequence number assigned
     */
    AuditEntry append(AuditEntry entry);

    /** All entries in append order. */
    List<AuditEntry> findAll();

    /** Entries for one proposal in append order. */
    List<AuditEntry> findByProposalId(String proposalId);

    /** Most recent CONFIG_CHANGE entry, used to restore the engine config on startup. */
    Optional<AuditEntry> findLatestConfigChange();
}
