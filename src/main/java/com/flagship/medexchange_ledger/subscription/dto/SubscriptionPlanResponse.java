package com.flagship.medexchange_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.subscription.SubscriptionPlanEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SubscriptionPlanResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("tier")
    String tier;

    @JsonProperty("name")
    String name;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("duration_days")
    int durationDays;

    public static SubscriptionPlanResponse from(SubscriptionPlanEntity plan) {
        return SubscriptionPlanResponse.builder()
                .id(plan.getId())
                .tier(plan.getTier().name())
                .name(plan.getName())
                .price(MoneyNormalizer.fromSmallestUnit(plan.getPrice(), plan.getCurrency()))
                .currency(plan.getCurrency().name())
                .durationDays(plan.getDurationDays())
                .build();
    }
}
