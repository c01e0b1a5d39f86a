package com.security.response.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ApproveRequestDto {

    @NotBlank(message = "actor is required")
    private String actor;
}
