package com.flagship.medexchange_ledger.earnings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.earnings.CourierPayoutEntity;
import com.flagship.medexchange_ledger.earnings.PayoutStatus;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PayoutResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("status")
    PayoutStatus status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("requested_at")
    Instant requestedAt;

    public static PayoutResponse from(CourierPayoutEntity payout) {
        return PayoutResponse.builder()
                .id(payout.getId())
                .reference(payout.getReference())
                .status(payout.getStatus())
                .amount(MoneyNormalizer.fromSmallestUnit(payout.getAmount(), payout.getCurrency()))
                .fee(MoneyNormalizer.fromSmallestUnit(payout.getFee(), payout.getCurrency()))
                .netAmount(MoneyNormalizer.fromSmallestUnit(payout.getNetAmount(), payout.getCurrency()))
                .currency(payout.getCurrency().name())
                .failureReason(payout.getFailureReason())
                .requestedAt(payout.getRequestedAt())
                .build();
    }
}
