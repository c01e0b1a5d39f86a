package com.security.response.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only audit record. Proposal fields are null for config changes and vice versa.
 */
@Value
@Builder(toBuilder = true)
public class AuditEntry {

    /** Assigned by the audit log on append; strictly increasing. */
    Long sequence;
    Instant timestamp;
    AuditEventType eventType;
    String actor;

    String proposalId;
    String target;
    ActionType actionType;
    ProposalStatus fromStatus;
    ProposalStatus toStatus;

    EngineConfig configBefore;
    EngineConfig configAfter;

    String detail;
}
