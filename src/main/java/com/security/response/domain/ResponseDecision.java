package com.security.response.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Result of one correlate-and-propose cycle.
 */
@Value
@Builder
public class ResponseDecision {

    public enum Outcome {
        CREATED,
        SUPERSEDED,
        MONITOR_ONLY
    }

    Outcome outcome;
    String target;
    /** Null when {@link Outcome#MONITOR_ONLY}. */
    ActionProposal proposal;
    String supersededProposalId;
    CorrelationResult correlation;
    String message;
}
