package com.flagship.medexchange_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.medexchange_ledger.workflow.event.DeliveryCompletedEvent;
import com.flagship.medexchange_ledger.workflow.event.ExchangeAcceptedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka consumer for workflow events.
 *
 * Offsets are acknowledged manually, after the handler's transaction has
 * committed. A handler failure leaves the record unacknowledged so it is
 * redelivered; replays are absorbed by the handler's idempotency record.
 * Records that cannot be parsed, and event types this service does not react
 * to, are acknowledged and skipped.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WorkflowEventConsumer {

    private final WorkflowEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @Value("${spring.kafka.consumer.group-id:medexchange-ledger-consumers}")
    private String consumerGroup;

    @KafkaListener(
        topics = "${kafka.topic.workflow-events:workflow-events}",
        groupId = "${spring.kafka.consumer.group-id:medexchange-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = route(envelope, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}", envelope.eventType(), envelope.eventId());
            } else {
                log.debug("Event {} ({}) skipped", envelope.eventId(), envelope.eventType());
            }
        } catch (RuntimeException e) {
            log.error("Error processing event {} ({}) at offset {}: {}",
                    envelope.eventId(), envelope.eventType(), record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    private boolean route(EventEnvelope envelope, String payload) {
        return switch (envelope.eventType()) {
            case ExchangeAcceptedEvent.EVENT_TYPE ->
                    eventHandler.onExchangeAccepted(deserialize(payload, ExchangeAcceptedEvent.class), consumerGroup);
            case DeliveryCompletedEvent.EVENT_TYPE ->
                    eventHandler.onDeliveryCompleted(deserialize(payload, DeliveryCompletedEvent.class), consumerGroup);
            default -> false;
        };
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("eventType")) {
                return null;
            }
            return new EventEnvelope(UUID.fromString(node.get("eventId").asText()), node.get("eventType").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private record EventEnvelope(UUID eventId, String eventType) {}
}
