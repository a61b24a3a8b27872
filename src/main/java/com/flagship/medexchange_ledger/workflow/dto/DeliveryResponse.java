package com.flagship.medexchange_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.workflow.DeliveryEntity;
import com.flagship.medexchange_ledger.workflow.DeliveryPaymentStatus;
import com.flagship.medexchange_ledger.workflow.DeliveryStatus;
import com.flagship.medexchange_ledger.workflow.PartyPayment;
import com.flagship.medexchange_ledger.workflow.PartyPaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Hand-over codes are only included for the two parties and administrators;
 * the courier learns them from the parties at the door.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliveryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("exchange_id")
    UUID exchangeId;

    @JsonProperty("from_party_id")
    String fromPartyId;

    @JsonProperty("to_party_id")
    String toPartyId;

    @JsonProperty("courier_id")
    String courierId;

    @JsonProperty("city_id")
    String cityId;

    @JsonProperty("status")
    DeliveryStatus status;

    @JsonProperty("payment_status")
    DeliveryPaymentStatus paymentStatus;

    @JsonProperty("fee")
    long fee;

    @JsonProperty("fee_per_party")
    long feePerParty;

    @JsonProperty("fee_display")
    String feeDisplay;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("from_payment_status")
    PartyPaymentStatus fromPaymentStatus;

    @JsonProperty("to_payment_status")
    PartyPaymentStatus toPaymentStatus;

    @JsonProperty("pickup_code")
    String pickupCode;

    @JsonProperty("delivery_code")
    String deliveryCode;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("assigned_at")
    Instant assignedAt;

    @JsonProperty("picked_up_at")
    Instant pickedUpAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static DeliveryResponse from(DeliveryEntity entity, boolean includeCodes) {
        PartyPayment from = entity.getFromPayment();
        PartyPayment to = entity.getToPayment();
        return DeliveryResponse.builder()
                .id(entity.getId())
                .exchangeId(entity.getExchangeId())
                .fromPartyId(entity.getFromPartyId())
                .toPartyId(entity.getToPartyId())
                .courierId(entity.getCourierId())
                .cityId(entity.getLocation().getCityId())
                .status(entity.getStatus())
                .paymentStatus(entity.getPaymentStatus())
                .fee(entity.getFee())
                .feePerParty(entity.getFeePerParty())
                .feeDisplay(MoneyNormalizer.formatForDisplay(entity.getFee(), entity.getCurrency()))
                .currency(entity.getCurrency().name())
                .fromPaymentStatus(from.getStatus())
                .toPaymentStatus(to.getStatus())
                .pickupCode(includeCodes ? entity.getPickupCode() : null)
                .deliveryCode(includeCodes ? entity.getDeliveryCode() : null)
                .failureReason(entity.getFailureReason())
                .assignedAt(entity.getAssignedAt())
                .pickedUpAt(entity.getPickedUpAt())
                .completedAt(entity.getCompletedAt())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
