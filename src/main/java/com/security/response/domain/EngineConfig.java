package com.security.response.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Process-wide approval settings. Immutable; updates produce a new instance through
 * {@link com.security.response.core.EngineConfigService}, which validates and audits them.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EngineConfig {

    public static final double DEFAULT_AUTO_APPROVE_THRESHOLD = 0.90;
    public static final double DEFAULT_REVIEW_THRESHOLD = 0.70;

    /** Confidence at or above which a proposal is approved without review. */
    @Builder.Default
    double autoApproveThreshold = DEFAULT_AUTO_APPROVE_THRESHOLD;
    /** Confidence at or above which a proposal is created for review. */
    @Builder.Default
    double reviewThreshold = DEFAULT_REVIEW_THRESHOLD;
    /** Safety override: every proposal requires a human decision. */
    boolean forceManualApproval;

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }
}
