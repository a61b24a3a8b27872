package com.flagship.medexchange_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A workflow event waiting in the outbox table to be published to Kafka.
 * Written in the same transaction as the state change it announces.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Exchange" or "Delivery"
    UUID aggregateId;
    String eventType;          // e.g. "ExchangeAccepted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
