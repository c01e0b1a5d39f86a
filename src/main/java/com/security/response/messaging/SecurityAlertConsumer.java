package com.security.response.messaging;

import com.security.response.api.DuplicateTargetException;
import com.security.response.api.InsufficientEvidenceException;
import com.security.response.core.ResponseOrchestrator;
import com.security.response.domain.ActionType;
import com.security.response.domain.RawAlert;
import com.security.response.domain.ResponseDecision;
import com.security.response.evidence.AlertFeedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Consumes normalized alerts from the security-alerts topic into the alert feed. With
 * auto-response enabled, each alert also triggers a correlation cycle for its target.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "response.kafka.consumer.enabled", havingValue = "true", matchIfMissing = true)
public class SecurityAlertConsumer {

    static final String AUTO_RESPONSE_ACTOR = "auto-response";

    private final AlertFeedStore feedStore;
    private final ResponseOrchestrator orchestrator;

    @Value("${response.auto-response.enabled:false}")
    private boolean autoResponseEnabled;

    @Value("${response.auto-response.action-type:ISOLATE_HOST}")
    private ActionType autoResponseActionType;

    @KafkaListener(
            topics = "${response.kafka.topic.security-alerts:security-alerts}",
            groupId = "${response.kafka.consumer-group:autonomous-response-engine}",
            containerFactory = "securityAlertListenerContainerFactory"
    )
    public void onAlert(
            @Payload(required = false) RawAlert alert,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        if (alert == null || alert.getTarget() == null || alert.getSource() == null) {
            log.warn("Dropping malformed security alert key={} offset={} alert={}", key, offset, alert);
            return;
        }
        feedStore.add(alert);
        log.info("Ingested alert: referenceId={}, source={}, target={}, severity={}, tags={}",
                alert.getReferenceId(), alert.getSource(), alert.getTarget(), alert.getSeverity(), alert.getTechniqueTags());
        if (autoResponseEnabled) {
            respond(alert.getTarget());
        }
    }

    void respond(String target) {
        try {
            ResponseDecision decision = orchestrator.correlateAndPropose(target, autoResponseActionType, AUTO_RESPONSE_ACTOR);
            log.info("Auto-response for target={}: {}", target, decision.getOutcome());
        } catch (DuplicateTargetException e) {
            log.info("Auto-response for target={}: evidence attached to active proposal {}", target, e.getExistingProposalId());
        } catch (InsufficientEvidenceException e) {
            log.info("Auto-response for target={}: {}", target, e.getMessage());
        } catch (Exception e) {
            log.error("Auto-response failed for target={}", target, e);
        }
    }
}
