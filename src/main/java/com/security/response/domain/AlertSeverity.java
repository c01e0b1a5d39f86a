package com.security.response.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum AlertSeverity {
    INFORMATIONAL,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Vendors send "critical", "High", etc. Unknown values map to INFORMATIONAL. */
    @JsonCreator
    public static AlertSeverity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return INFORMATIONAL;
        }
        try {
            return AlertSeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INFORMATIONAL;
        }
    }
}
