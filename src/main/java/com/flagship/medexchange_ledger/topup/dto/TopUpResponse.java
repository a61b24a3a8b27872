package com.flagship.medexchange_ledger.topup.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.topup.TopUpRequestEntity;
import com.flagship.medexchange_ledger.topup.TopUpStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TopUpResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tx_ref")
    String txRef;

    @JsonProperty("status")
    TopUpStatus status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("payment_link")
    String paymentLink;

    @JsonProperty("expires_at")
    Instant expiresAt;

    public static TopUpResponse from(TopUpRequestEntity entity) {
        return TopUpResponse.builder()
                .id(entity.getId())
                .txRef(entity.getTxRef())
                .status(entity.getStatus())
                .amount(MoneyNormalizer.fromSmallestUnit(entity.getAmount(), entity.getCurrency()))
                .currency(entity.getCurrency().name())
                .paymentMethod(entity.getPaymentMethod().getWireValue())
                .paymentLink(entity.getPaymentLink())
                .expiresAt(entity.getExpiresAt())
                .build();
    }
}
