package com.security.response.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ProposalStats {

    long total;
    Map<ProposalStatus, Long> byStatus;
    Map<ActionType, Long> byActionType;
    long requiresApproval;
}
