package com.security.response.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Input to the proposal factory, from the correlator or from an external producer
 * (reasoning agent, analyst).
 */
@Value
@Builder
public class ProposalDraft {

    ActionType actionType;
    String target;
    double confidence;
    List<String> evidence;
    String reason;
    String createdBy;
    /** Optional; derived from action type and target when absent. */
    String title;
    Map<String, String> parameters;
}
