package com.security.response.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Operator query over proposals. Null fields do not filter.
 */
@Value
@Builder
public class ProposalFilter {

    ProposalStatus status;
    String target;
    ActionType actionType;
    Boolean requiresApproval;

    public static ProposalFilter all() {
        return ProposalFilter.builder().build();
    }

    public static ProposalFilter byStatus(ProposalStatus status) {
        return ProposalFilter.builder().status(status).build();
    }

    public boolean matches(ActionProposal proposal) {
        return (status == null || status == proposal.getStatus())
                && (target == null || target.equals(proposal.getTarget()))
                && (actionType == null || actionType == proposal.getActionType())
                && (requiresApproval == null || requiresApproval == proposal.isRequiresApproval());
    }
}
