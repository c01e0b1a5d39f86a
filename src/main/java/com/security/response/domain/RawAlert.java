package com.security.response.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Set;

/**
 * Alert as returned by an external source, normalized to the fields correlation needs.
 */
@Value
@Builder
@Jacksonized
public class RawAlert {

    /** Finding / alert id in the source system. Used as evidence reference. */
    String referenceId;
    AlertSource source;
    /** Entity the alert is about (IP, hostname, user, domain). */
    String target;
    AlertSeverity severity;
    Instant timestamp;
    /** Free-form indicator labels, e.g. "ransomware", "c2_beacon", "T1021". */
    Set<String> techniqueTags;
    String description;
}
