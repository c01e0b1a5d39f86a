package com.security.response.messaging;

import com.security.response.domain.ActionProposal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes proposal lifecycle events for notification and ticketing consumers.
 * Publishing is best effort: the audit log, not Kafka, is the record of truth, so a
 * broker failure is logged and never fails the lifecycle operation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionEventProducer {

    private final KafkaTemplate<String, ActionEvent> kafkaTemplate;

    @Value("${response.kafka.topic.action-events:response-action-events}")
    private String topic;

    public void publishStatus(ActionProposal proposal, String actor) {
        publish("PROPOSAL_" + proposal.getStatus().name(), proposal, actor, statusDetail(proposal));
    }

    public void publishCreated(ActionProposal proposal) {
        publish("PROPOSAL_CREATED", proposal, proposal.getCreatedBy(), proposal.getReason());
    }

    public void publishEvidenceAttached(ActionProposal proposal, String actor) {
        publish("EVIDENCE_ATTACHED", proposal, actor, "attachedEvidence=" + proposal.getAttachedEvidence());
    }

    private void publish(String eventType, ActionProposal proposal, String actor, String detail) {
        ActionEvent event = ActionEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .proposalId(proposal.getProposalId())
                .actionType(proposal.getActionType())
                .target(proposal.getTarget())
                .confidence(proposal.getConfidence())
                .status(proposal.getStatus())
                .requiresApproval(proposal.isRequiresApproval())
                .actor(actor)
                .detail(detail)
                .timestamp(Instant.now())
                .build();
        send(proposal.getTarget(), event);
    }

    private void send(String key, ActionEvent event) {
        log.debug("Publishing action event: key={}, eventId={}, eventType={}, proposalId={}",
                key, event.getEventId(), event.getEventType(), event.getProposalId());
        try {
            CompletableFuture<SendResult<String, ActionEvent>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish action event key={} eventId={} eventType={}",
                            key, event.getEventId(), event.getEventType(), ex);
                } else {
                    log.debug("Published action event: key={}, eventId={}, partition={}, offset={}",
                            key, event.getEventId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (RuntimeException e) {
            log.error("Kafka send rejected for action event key={} eventType={}", key, event.getEventType(), e);
        }
    }

    private static String statusDetail(ActionProposal p) {
        if (p.getResult() != null) {
            return p.getResult().isSuccess() ? p.getResult().getDetail() : p.getResult().getError();
        }
        return p.getRejectionReason();
    }
}
