package com.security.response.api;

import com.security.response.domain.ActionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class CorrelateRequestDto {

    @NotBlank(message = "target is required")
    private String target;

    @NotNull(message = "actionType is required")
    private ActionType actionType;

    @NotBlank(message = "createdBy is required")
    private String createdBy;

    /** Overall evidence-gathering budget; server default when absent. */
    @Positive
    private Long deadlineMs;
}
