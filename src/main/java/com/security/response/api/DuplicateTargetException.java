package com.security.response.api;

/**
 * The target already has an active proposal and the new one does not raise confidence.
 * The new evidence has been attached to the existing proposal. Handler returns HTTP 409.
 */
public class DuplicateTargetException extends ResponseEngineException {

    private final String target;
    private final String existingProposalId;

    public DuplicateTargetException(String target, String existingProposalId) {
        super(String.format("Target %s already has active proposal %s; evidence attached to it",
                target, existingProposalId));
        this.target = target;
        this.existingProposalId = existingProposalId;
    }

    public String getTarget() {
        return target;
    }

    public String getExistingProposalId() {
        return existingProposalId;
    }
}
