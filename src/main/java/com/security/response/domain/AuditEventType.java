package com.security.response.domain;

public enum AuditEventType {
    /** New proposal stored (from = null, to = initial status). */
    PROPOSAL_CREATED,
    /** Status change of an existing proposal. */
    PROPOSAL_TRANSITION,
    /** Duplicate proposal's evidence attached to the active one. */
    EVIDENCE_ATTACHED,
    /** Operator changed {@link EngineConfig}. */
    CONFIG_CHANGE
}
