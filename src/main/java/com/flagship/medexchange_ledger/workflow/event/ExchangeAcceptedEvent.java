package com.flagship.medexchange_ledger.workflow.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a responder accepts an exchange; triggers delivery creation.
 */
@Value
public class ExchangeAcceptedEvent implements WorkflowEvent {

    public static final String EVENT_TYPE = "ExchangeAccepted";

    UUID eventId;
    UUID exchangeId;
    String requesterId;
    String responderId;
    String cityId;
    String countryCode;
    Instant occurredAt;

    public static ExchangeAcceptedEvent of(UUID exchangeId, String requesterId, String responderId,
                                           String cityId, String countryCode, Instant occurredAt) {
        return new ExchangeAcceptedEvent(UUID.randomUUID(), exchangeId, requesterId, responderId,
                cityId, countryCode, occurredAt);
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return exchangeId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
