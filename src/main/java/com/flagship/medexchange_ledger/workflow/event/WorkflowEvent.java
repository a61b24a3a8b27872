package com.flagship.medexchange_ledger.workflow.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A workflow fact written to the outbox and consumed from Kafka.
 * {@code eventId} deduplicates redelivery.
 */
public interface WorkflowEvent {

    UUID getEventId();

    /**
     * The exchange or delivery the event is about; the Kafka record key.
     */
    UUID getAggregateId();

    String getEventType();

    Instant getOccurredAt();
}
