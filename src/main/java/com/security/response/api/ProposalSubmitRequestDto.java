package com.security.response.api;

import com.security.response.domain.ActionType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Proposal from an external producer (reasoning agent, analyst, detection rule).
 */
@Data
public class ProposalSubmitRequestDto {

    @NotNull(message = "actionType is required")
    private ActionType actionType;

    @NotBlank(message = "target is required")
    private String target;

    @NotNull(message = "confidence is required")
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;

    /** Alert / finding references backing the confidence. */
    @NotEmpty(message = "evidence must not be empty")
    private List<String> evidence;

    @NotBlank(message = "reason is required")
    private String reason;

    @NotBlank(message = "createdBy is required")
    private String createdBy;

    private String title;
    private Map<String, String> parameters;
}
