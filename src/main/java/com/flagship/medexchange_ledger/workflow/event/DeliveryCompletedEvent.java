package com.flagship.medexchange_ledger.workflow.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the assigned courier delivers; triggers the courier's earning.
 * {@code fee} is in smallest units of {@code currency}.
 */
@Value
public class DeliveryCompletedEvent implements WorkflowEvent {

    public static final String EVENT_TYPE = "DeliveryCompleted";

    UUID eventId;
    UUID deliveryId;
    UUID exchangeId;
    String courierId;
    long fee;
    String currency;
    Instant occurredAt;

    public static DeliveryCompletedEvent of(UUID deliveryId, UUID exchangeId, String courierId,
                                            long fee, String currency, Instant occurredAt) {
        return new DeliveryCompletedEvent(UUID.randomUUID(), deliveryId, exchangeId, courierId,
                fee, currency, occurredAt);
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return deliveryId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
