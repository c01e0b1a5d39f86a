package com.security.response.core;

import com.security.response.domain.ApprovalDecision;
import com.security.response.domain.EngineConfig;
import org.springframework.stereotype.Component;

/**
 * Maps a confidence score to the initial lifecycle decision. Pure: the config is passed in
 * on every call and nothing is cached.
 * <p>
 * {@code forceManualApproval} is checked first and forces a human decision for every
 * proposal, whatever its confidence. Both threshold comparisons are inclusive.
 */
@Component
public class ApprovalGate {

    public ApprovalDecision decide(double confidence, EngineConfig config) {
        if (config.isForceManualApproval()) {
            return ApprovalDecision.REQUIRE_APPROVAL;
        }
        if (confidence >= config.getAutoApproveThreshold()) {
            return ApprovalDecision.AUTO_APPROVE;
        }
        if (confidence >= config.getReviewThreshold()) {
            return ApprovalDecision.REQUIRE_APPROVAL;
        }
        return ApprovalDecision.MONITOR_ONLY;
    }
}
