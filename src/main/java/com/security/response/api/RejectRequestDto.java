package com.security.response.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RejectRequestDto {

    @NotBlank(message = "actor is required")
    private String actor;

    @NotBlank(message = "reason is required")
    private String reason;
}
