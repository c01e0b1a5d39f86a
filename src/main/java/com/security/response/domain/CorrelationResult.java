package com.security.response.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Output of the correlator for one target.
 */
@Value
@Builder
public class CorrelationResult {

    /** Clamped to [0.0, 1.0]. */
    double confidence;
    /** Fired conditions in rule-table order, followed by zero-weight source failures. */
    List<CorrelationFactor> factors;
    /** De-duplicated references of alerts that contributed to a fired condition. */
    List<String> evidence;
    int alertCount;
    /** Sources that failed or timed out, with the error. */
    Map<AlertSource, String> failedSources;

    public static CorrelationResult empty(Map<AlertSource, String> failedSources) {
        return CorrelationResult.builder()
                .confidence(0.0)
                .factors(List.of())
                .evidence(List.of())
                .alertCount(0)
                .failedSources(failedSources)
                .build();
    }

    public boolean hasAlerts() {
        return alertCount > 0;
    }
}
