package com.flagship.medexchange_ledger.consumer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.medexchange_ledger.workflow.event.DeliveryCompletedEvent;
import com.flagship.medexchange_ledger.workflow.event.ExchangeAcceptedEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Routing and acknowledgement rules of the workflow consumer, without Kafka.
 */
class WorkflowEventConsumerTest {

    private static final String GROUP = "medexchange-ledger-consumers";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private WorkflowEventHandler handler;
    private Acknowledgment ack;
    private WorkflowEventConsumer consumer;

    @BeforeEach
    void setUp() {
        handler = mock(WorkflowEventHandler.class);
        ack = mock(Acknowledgment.class);
        consumer = new WorkflowEventConsumer(handler, objectMapper);
        ReflectionTestUtils.setField(consumer, "consumerGroup", GROUP);
    }

    @Test
    void routesExchangeAccepted() throws Exception {
        ExchangeAcceptedEvent event = ExchangeAcceptedEvent.of(UUID.randomUUID(), "pharmacy-a", "pharmacy-b",
                "cm_douala", "CM", Instant.parse("2026-03-01T10:00:00Z"));
        when(handler.onExchangeAccepted(any(), eq(GROUP))).thenReturn(true);

        consumer.consume(record(event.getExchangeId(), objectMapper.writeValueAsString(event)), ack);

        verify(handler).onExchangeAccepted(argThat(e -> e.getEventId().equals(event.getEventId())
                && e.getResponderId().equals("pharmacy-b")), eq(GROUP));
        verify(ack).acknowledge();
    }

    @Test
    void routesDeliveryCompleted() throws Exception {
        DeliveryCompletedEvent event = DeliveryCompletedEvent.of(UUID.randomUUID(), UUID.randomUUID(), "courier-1",
                500, "XAF", Instant.parse("2026-03-01T12:00:00Z"));

        consumer.consume(record(event.getDeliveryId(), objectMapper.writeValueAsString(event)), ack);

        verify(handler).onDeliveryCompleted(argThat(e -> e.getFee() == 500 && "courier-1".equals(e.getCourierId())),
                eq(GROUP));
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unreadable records are acknowledged and skipped")
    void skipsUnparseableRecords() {
        consumer.consume(record(UUID.randomUUID(), "not json"), ack);
        consumer.consume(record(UUID.randomUUID(), "{\"eventType\":\"ExchangeAccepted\"}"), ack);

        verifyNoInteractions(handler);
        verify(ack, times(2)).acknowledge();
    }

    @Test
    void ignoresUnknownEventTypes() {
        consumer.consume(record(UUID.randomUUID(),
                "{\"eventId\":\"" + UUID.randomUUID() + "\",\"eventType\":\"ExchangeArchived\"}"), ack);

        verifyNoInteractions(handler);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("A handler failure leaves the record unacknowledged for redelivery")
    void handlerFailureNotAcknowledged() throws Exception {
        ExchangeAcceptedEvent event = ExchangeAcceptedEvent.of(UUID.randomUUID(), "pharmacy-a", "pharmacy-b",
                "cm_douala", "CM", Instant.now());
        when(handler.onExchangeAccepted(any(), any())).thenThrow(new IllegalStateException("database down"));
        String payload = objectMapper.writeValueAsString(event);

        assertThrows(IllegalStateException.class, () -> consumer.consume(record(event.getExchangeId(), payload), ack));
        verify(ack, never()).acknowledge();
    }

    private static ConsumerRecord<String, String> record(UUID key, String value) {
        return new ConsumerRecord<>("workflow-events", 0, 0L, key.toString(), value);
    }
}
