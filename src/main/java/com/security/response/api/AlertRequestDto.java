package com.security.response.api;

import com.security.response.domain.AlertSource;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Instant;
import java.util.Set;

/**
 * Raw alert pushed by a connector or analyst. Severity is free text ("critical", "High");
 * unknown values are treated as informational.
 */
@Data
public class AlertRequestDto {

    @NotBlank(message = "referenceId is required")
    private String referenceId;

    @NotNull(message = "source is required")
    private AlertSource source;

    @NotBlank(message = "target is required")
    private String target;

    private String severity;
    private Instant timestamp;
    private Set<String> techniqueTags;
    private String description;
}
