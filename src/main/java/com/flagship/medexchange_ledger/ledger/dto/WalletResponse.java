package com.flagship.medexchange_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.ledger.Wallet;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class WalletResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("balance")
    BigDecimal balance;

    // Smallest currency units
    @JsonProperty("balance_minor")
    long balanceMinor;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("display")
    String display;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WalletResponse from(Wallet wallet) {
        return WalletResponse.builder()
                .userId(wallet.getUserId())
                .balance(MoneyNormalizer.fromSmallestUnit(wallet.getBalance(), wallet.getCurrency()))
                .balanceMinor(wallet.getBalance())
                .currency(wallet.getCurrency().name())
                .display(MoneyNormalizer.formatForDisplay(wallet.getBalance(), wallet.getCurrency()))
                .updatedAt(wallet.getUpdatedAt())
                .build();
    }
}
