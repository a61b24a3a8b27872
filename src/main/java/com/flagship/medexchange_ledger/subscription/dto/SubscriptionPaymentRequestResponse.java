package com.flagship.medexchange_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.subscription.SubscriptionRequestEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class SubscriptionPaymentRequestResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tx_ref")
    String txRef;

    @JsonProperty("plan_id")
    String planId;

    @JsonProperty("status")
    String status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("payment_link")
    String paymentLink;

    public static SubscriptionPaymentRequestResponse from(SubscriptionRequestEntity entity) {
        return SubscriptionPaymentRequestResponse.builder()
                .id(entity.getId())
                .txRef(entity.getTxRef())
                .planId(entity.getPlanId())
                .status(entity.getStatus().name())
                .amount(MoneyNormalizer.fromSmallestUnit(entity.getAmount(), entity.getCurrency()))
                .currency(entity.getCurrency().name())
                .paymentLink(entity.getPaymentLink())
                .build();
    }
}
