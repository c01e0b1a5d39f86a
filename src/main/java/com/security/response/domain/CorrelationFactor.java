package com.security.response.domain;

import lombok.Value;

import java.util.Locale;

/**
 * One correlation condition that fired and the weight it contributed.
 */
@Value
public class CorrelationFactor {

    String name;
    double weightContribution;

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s (+%.2f)", name, weightContribution);
    }
}
