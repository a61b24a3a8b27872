package com.flagship.medexchange_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.medexchange_ledger.IntegrationTestSupport;
import com.flagship.medexchange_ledger.workflow.ExchangeEntity;
import com.flagship.medexchange_ledger.workflow.ExchangeService;
import com.flagship.medexchange_ledger.workflow.dto.CreateExchangeRequest;
import com.flagship.medexchange_ledger.workflow.dto.ExchangeItemRequest;
import com.flagship.medexchange_ledger.workflow.event.ExchangeAcceptedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox writes: atomic with the state change that causes them, retry
 * tracking for the publisher.
 */
class OutboxServiceTest extends IntegrationTestSupport {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private ExchangeService exchangeService;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Accepting an exchange writes ExchangeAccepted with the parties and place")
    void acceptWritesEvent() throws Exception {
        String requesterId = uniqueId("pharmacy-a");
        String responderId = uniqueId("pharmacy-b");
        ExchangeEntity exchange = as(party(requesterId, "sn_dakar"), () -> exchangeService.create(
                new CreateExchangeRequest("sn_dakar", "SN", "Urgent",
                        List.of(new ExchangeItemRequest("insulin-glargine", "Insulin glargine", 2)), null, true)));

        as(party(responderId, "sn_dakar"), () -> exchangeService.accept(exchange.getId()));

        List<OutboxEvent> events = outboxService.getEventsForAggregate("exchange", exchange.getId());
        assertEquals(1, events.size());
        OutboxEvent event = events.get(0);
        assertEquals(ExchangeAcceptedEvent.EVENT_TYPE, event.getEventType());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals(ExchangeAcceptedEvent.EVENT_TYPE, payload.get("eventType").asText());
        assertNotNull(payload.get("eventId"));
        assertEquals(exchange.getId().toString(), payload.get("exchangeId").asText());
        assertEquals(responderId, payload.get("responderId").asText());
        assertEquals("SN", payload.get("countryCode").asText());
        assertNull(payload.get("aggregateId"));
    }

    @Test
    @DisplayName("An event is never written outside a transaction")
    void saveEventRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () ->
                outboxService.saveEvent("exchange", UUID.randomUUID(), "Orphan", new TestPayload("x", 1)));
    }

    @Test
    void rolledBackWorkLeavesNoEvent() {
        UUID aggregateId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent("exchange", aggregateId, "Doomed", new TestPayload("x", 1));
            throw new IllegalStateException("business step failed");
        }));

        assertTrue(outboxService.getEventsForAggregate("exchange", aggregateId).isEmpty());
    }

    @Test
    @DisplayName("Failed publishes count retries and keep the last error")
    void markFailedTracksRetries() {
        UUID aggregateId = UUID.randomUUID();
        OutboxEvent event = transactionTemplate.execute(status ->
                outboxService.saveEvent("delivery", aggregateId, "Probe", new TestPayload("probe", 7)));

        outboxService.markFailed(event.getId(), "Connection timeout");
        outboxService.markFailed(event.getId(), "Broker not available");

        OutboxEventEntity entity = outboxEventRepository.findById(event.getId()).orElseThrow();
        assertEquals(2, entity.getRetryCount());
        assertEquals("Broker not available", entity.getLastError());

        outboxService.markPublished(event.getId());
        assertTrue(outboxService.getEventsForAggregate("delivery", aggregateId).get(0).isPublished());
    }

    record TestPayload(String name, int value) {}
}
