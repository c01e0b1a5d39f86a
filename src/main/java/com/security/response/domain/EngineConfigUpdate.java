package com.security.response.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Partial {@link EngineConfig}: null fields keep their current value.
 */
@Value
@Builder
public class EngineConfigUpdate {

    Double autoApproveThreshold;
    Double reviewThreshold;
    Boolean forceManualApproval;

    public EngineConfig applyTo(EngineConfig current) {
        return current.toBuilder()
                .autoApproveThreshold(autoApproveThreshold != null ? autoApproveThreshold : current.getAutoApproveThreshold())
                .reviewThreshold(reviewThreshold != null ? reviewThreshold : current.getReviewThreshold())
                .forceManualApproval(forceManualApproval != null ? forceManualApproval : current.isForceManualApproval())
                .build();
    }
}
