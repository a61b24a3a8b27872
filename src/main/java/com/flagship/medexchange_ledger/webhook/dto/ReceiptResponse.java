package com.flagship.medexchange_ledger.webhook.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.webhook.NotificationOutcome;
import com.flagship.medexchange_ledger.webhook.NotificationReceiptEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ReceiptResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("provider")
    String provider;

    @JsonProperty("provider_tx_id")
    String providerTxId;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("purpose")
    String purpose;

    @JsonProperty("outcome")
    NotificationOutcome outcome;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("received_at")
    Instant receivedAt;

    public static ReceiptResponse from(NotificationReceiptEntity entity) {
        return ReceiptResponse.builder()
                .id(entity.getId())
                .provider(entity.getProvider())
                .providerTxId(entity.getProviderTxId())
                .eventType(entity.getEventType())
                .reference(entity.getTxRef())
                .purpose(entity.getPurpose())
                .outcome(entity.getOutcome())
                .errorMessage(entity.getErrorMessage())
                .receivedAt(entity.getReceivedAt())
                .build();
    }
}
