package com.security.response.api;

import com.security.response.core.EngineConfigService;
import com.security.response.domain.EngineConfig;
import com.security.response.domain.EngineConfigUpdate;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/config")
@RequiredArgsConstructor
@Tag(name = "Engine config", description = "Approval thresholds and the force-manual-approval override")
public class EngineConfigController {

    private final EngineConfigService configService;

    @GetMapping
    @Operation(summary = "Current engine config")
    public ResponseEntity<EngineConfig> get() {
        return ResponseEntity.ok(configService.current());
    }

    @PatchMapping
    @Operation(summary = "Update engine config",
            description = "Partial update; audited. Applies to every proposal gated after the response.")
    public ResponseEntity<EngineConfig> update(@Valid @RequestBody ConfigUpdateRequestDto dto) {
        EngineConfigUpdate update = EngineConfigUpdate.builder()
                .autoApproveThreshold(dto.getAutoApproveThreshold())
                .reviewThreshold(dto.getReviewThreshold())
                .forceManualApproval(dto.getForceManualApproval())
                .build();
        return ResponseEntity.ok(configService.update(update, dto.getActor()));
    }
}
