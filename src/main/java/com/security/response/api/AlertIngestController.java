package com.security.response.api;

import com.security.response.domain.AlertSeverity;
import com.security.response.domain.RawAlert;
import com.security.response.evidence.AlertFeedStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * HTTP alternative to the security-alerts topic, for connectors without Kafka and for testing.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
@Tag(name = "Alerts", description = "Raw alert ingestion into the evidence feed")
public class AlertIngestController {

    private final AlertFeedStore feedStore;

    @PostMapping
    @Operation(summary = "Ingest alert", description = "Adds the alert to the feed queried by the built-in evidence sources")
    public ResponseEntity<Map<String, Object>> ingest(@Valid @RequestBody AlertRequestDto dto) {
        RawAlert alert = RawAlert.builder()
                .referenceId(dto.getReferenceId())
                .source(dto.getSource())
                .target(dto.getTarget())
                .severity(AlertSeverity.fromValue(dto.getSeverity()))
                .timestamp(dto.getTimestamp() != null ? dto.getTimestamp() : Instant.now())
                .techniqueTags(dto.getTechniqueTags() != null ? Set.copyOf(dto.getTechniqueTags()) : Set.of())
                .description(dto.getDescription())
                .build();
        feedStore.add(alert);
        log.info("Ingested alert via API: referenceId={}, source={}, target={}, severity={}",
                alert.getReferenceId(), alert.getSource(), alert.getTarget(), alert.getSeverity());
        return ResponseEntity.accepted().body(Map.of(
                "referenceId", alert.getReferenceId(),
                "target", alert.getTarget(),
                "alertsForTarget", feedStore.size(alert.getTarget())));
    }
}
