package com.security.response.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Partial engine config update. Absent fields keep their current value; range checks happen
 * in the service so that an invalid combination is reported as a configuration error.
 */
@Data
public class ConfigUpdateRequestDto {

    @NotBlank(message = "actor is required")
    private String actor;

    private Double autoApproveThreshold;
    private Double reviewThreshold;
    private Boolean forceManualApproval;
}
