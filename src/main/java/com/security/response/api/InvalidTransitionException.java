package com.security.response.api;

import com.security.response.domain.ProposalStatus;

/**
 * Lifecycle operation on a proposal that is not in the expected state: double approve,
 * approve after reject, or the loser of a concurrent race. Handler returns HTTP 409.
 */
public class InvalidTransitionException extends ResponseEngineException {

    private final String proposalId;
    private final ProposalStatus actualStatus;
    private final ProposalStatus requestedStatus;

    public InvalidTransitionException(String proposalId, ProposalStatus actualStatus,
                                      ProposalStatus expectedStatus, ProposalStatus requestedStatus) {
        super(String.format("Proposal %s cannot move to %s: expected status %s but was %s",
                proposalId, requestedStatus, expectedStatus, actualStatus));
        this.proposalId = proposalId;
        this.actualStatus = actualStatus;
        this.requestedStatus = requestedStatus;
    }

    public String getProposalId() {
        return proposalId;
    }

    public ProposalStatus getActualStatus() {
        return actualStatus;
    }

    public ProposalStatus getRequestedStatus() {
        return requestedStatus;
    }
}
