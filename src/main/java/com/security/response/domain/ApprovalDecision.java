package com.security.response.domain;

/**
 * Result of the Approval Gate for a given confidence and {@link EngineConfig}.
 */
public enum ApprovalDecision {
    /** Proposal is created already APPROVED and goes straight to execution. */
    AUTO_APPROVE(ProposalStatus.APPROVED, false),
    /** Proposal is created PENDING and waits for a human decision. */
    REQUIRE_APPROVAL(ProposalStatus.PENDING, true),
    /** Confidence too low: no proposal is created, keep monitoring. */
    MONITOR_ONLY(null, false);

    private final ProposalStatus initialStatus;
    private final boolean requiresApproval;

    ApprovalDecision(ProposalStatus initialStatus, boolean requiresApproval) {
        this.initialStatus = initialStatus;
        this.requiresApproval = requiresApproval;
    }

    /** Initial status of the proposal, or null for {@link #MONITOR_ONLY}. */
    public ProposalStatus getInitialStatus() {
        return initialStatus;
    }

    public boolean requiresApproval() {
        return requiresApproval;
    }

    public boolean createsProposal() {
        return this != MONITOR_ONLY;
    }
}
