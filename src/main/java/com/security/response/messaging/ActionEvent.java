package com.security.response.messaging;

import com.security.response.domain.ActionType;
import com.security.response.domain.ProposalStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Event emitted to Kafka whenever a proposal is created, changes status or receives
 * attached evidence. Keyed by target so consumers see one target's events in order.
 */
@Value
@Builder
@Jacksonized
public class ActionEvent {

    String eventId;
    /** PROPOSAL_CREATED, PROPOSAL_APPROVED, PROPOSAL_REJECTED, PROPOSAL_EXECUTING, PROPOSAL_EXECUTED, PROPOSAL_FAILED, EVIDENCE_ATTACHED */
    String eventType;
    String proposalId;
    ActionType actionType;
    String target;
    double confidence;
    ProposalStatus status;
    boolean requiresApproval;
    String actor;
    String detail;
    Instant timestamp;
}
