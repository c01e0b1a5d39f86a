package com.security.response.domain;

import lombok.Value;

/**
 * What the registry did with a new proposal for a target.
 */
@Value
public class RegistrationResult {

    public enum Outcome {
        /** No active proposal existed; the candidate was stored. */
        CREATED,
        /** A lower-confidence pending proposal was rejected and replaced by the candidate. */
        SUPERSEDED,
        /** An active proposal already covers the target; the candidate's evidence was attached to it. */
        DUPLICATE
    }

    Outcome outcome;
    /** The stored candidate, or the existing active proposal for {@link Outcome#DUPLICATE}. */
    ActionProposal proposal;
    /** Id of the proposal that was superseded, when {@link Outcome#SUPERSEDED}. */
    String supersededProposalId;

    public static RegistrationResult created(ActionProposal proposal) {
        return new RegistrationResult(Outcome.CREATED, proposal, null);
    }

    public static RegistrationResult superseded(ActionProposal proposal, String supersededProposalId) {
        return new RegistrationResult(Outcome.SUPERSEDED, proposal, supersededProposalId);
    }

    public static RegistrationResult duplicate(ActionProposal existing) {
        return new RegistrationResult(Outcome.DUPLICATE, existing, null);
    }
}
