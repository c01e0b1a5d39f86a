package com.security.response.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an {@link ActionProposal}. Transitions only move forward:
 * <pre>
 *   PENDING  -> APPROVED | REJECTED
 *   APPROVED -> EXECUTING -> EXECUTED | FAILED
 * </pre>
 * REJECTED, EXECUTED and FAILED are terminal.
 */
public enum ProposalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXECUTING,
    EXECUTED,
    FAILED;

    public boolean canTransitionTo(ProposalStatus next) {
        return allowedNext().contains(next);
    }

    public Set<ProposalStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(APPROVED, REJECTED);
            case APPROVED:
                return EnumSet.of(EXECUTING);
            case EXECUTING:
                return EnumSet.of(EXECUTED, FAILED);
            default:
                return EnumSet.noneOf(ProposalStatus.class);
        }
    }

    /** Active proposals hold the per-target slot; at most one per target. */
    public boolean isActive() {
        return !isTerminal();
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }
}
