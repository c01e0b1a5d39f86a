package com.security.response.registry;

import com.security.response.api.InvalidTransitionException;
import com.security.response.api.ProposalNotFoundException;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ProposalFilter;
import com.security.response.domain.ProposalStatus;
import com.security.response.domain.RegistrationResult;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Authoritative store of proposals and their lifecycle state.
 * <p>
 * Guarantees, under any interleaving of callers:
 * <ul>
 *   <li>at most one active (PENDING, APPROVED, EXECUTING) proposal per target;</li>
 *   <li>every status change is a compare-and-set against the expected current status;</li>
 *   <li>every creation and transition is audited atomically with the change.</li>
 * </ul>
 */
public interface ActionRegistry {

    /**
     * Store a new proposal, resolving a conflict with the target's active proposal:
     * a higher-confidence candidate supersedes a PENDING one; otherwise the candidate's
     * evidence is attached to the active proposal and nothing new is stored.
     *
     * @param candidate fully-built proposal in its initial status (PENDING or APPROVED)
     */
    RegistrationResult register(ActionProposal candidate);

    /**
     * Move a proposal from {@code expected} to {@code next}. The mutation may set decision or
     * execution fields; identity, evidence and confidence are kept from the stored proposal.
     *
     * @throws ProposalNotFoundException   unknown id
     * @throws InvalidTransitionException  current status is not {@code expected}, or the move is not allowed
     */
    ActionProposal transition(String proposalId, ProposalStatus expected, ProposalStatus next, String actor,
                              UnaryOperator<ActionProposal> mutation);

    Optional<ActionProposal> findById(String proposalId);

    Optional<ActionProposal> findActiveByTarget(String target);

    /** Matching proposals, newest first. */
    List<ActionProposal> find(ProposalFilter filter);
}
