package com.security.response.api;

public class ProposalNotFoundException extends ResponseEngineException {

    public ProposalNotFoundException(String proposalId) {
        super("Proposal not found: " + proposalId);
    }
}
