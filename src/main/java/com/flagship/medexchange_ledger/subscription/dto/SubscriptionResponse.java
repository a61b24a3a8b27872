package com.flagship.medexchange_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.subscription.SubscriptionEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class SubscriptionResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("plan_id")
    String planId;

    @JsonProperty("tier")
    String tier;

    @JsonProperty("status")
    String status;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("renew_at")
    Instant renewAt;

    public static SubscriptionResponse from(SubscriptionEntity entity) {
        return SubscriptionResponse.builder()
                .userId(entity.getUserId())
                .planId(entity.getPlanId())
                .tier(entity.getTier().name())
                .status(entity.getStatus().name())
                .paymentMethod(entity.getPaymentMethod().name().toLowerCase())
                .amount(MoneyNormalizer.fromSmallestUnit(entity.getAmount(), entity.getCurrency()))
                .currency(entity.getCurrency().name())
                .startedAt(entity.getStartedAt())
                .expiresAt(entity.getExpiresAt())
                .renewAt(entity.getRenewAt())
                .build();
    }
}
