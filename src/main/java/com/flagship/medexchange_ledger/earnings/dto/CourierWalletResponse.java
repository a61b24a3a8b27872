package com.flagship.medexchange_ledger.earnings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.earnings.CourierEarningEntity;
import com.flagship.medexchange_ledger.earnings.CourierEarningStatus;
import com.flagship.medexchange_ledger.earnings.CourierWalletEntity;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class CourierWalletResponse {

    @JsonProperty("courier_id")
    String courierId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("pending")
    BigDecimal pending;

    @JsonProperty("available")
    BigDecimal available;

    @JsonProperty("total_earned")
    BigDecimal totalEarned;

    @JsonProperty("total_paid_out")
    BigDecimal totalPaidOut;

    @JsonProperty("recent_earnings")
    List<Earning> recentEarnings;

    @Value
    @Builder
    public static class Earning {

        @JsonProperty("delivery_id")
        UUID deliveryId;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("status")
        CourierEarningStatus status;

        @JsonProperty("earned_at")
        Instant earnedAt;

        @JsonProperty("available_at")
        Instant availableAt;
    }

    public static CourierWalletResponse from(CourierWalletEntity wallet, List<CourierEarningEntity> earnings) {
        CurrencyCode currency = wallet.getCurrency();
        return CourierWalletResponse.builder()
                .courierId(wallet.getCourierId())
                .currency(currency.name())
                .balance(MoneyNormalizer.fromSmallestUnit(wallet.getBalance(), currency))
                .pending(MoneyNormalizer.fromSmallestUnit(wallet.getPending(), currency))
                .available(MoneyNormalizer.fromSmallestUnit(wallet.getAvailable(), currency))
                .totalEarned(MoneyNormalizer.fromSmallestUnit(wallet.getTotalEarned(), currency))
                .totalPaidOut(MoneyNormalizer.fromSmallestUnit(wallet.getTotalPaidOut(), currency))
                .recentEarnings(earnings.stream()
                        .map(e -> Earning.builder()
                                .deliveryId(e.getDeliveryId())
                                .amount(MoneyNormalizer.fromSmallestUnit(e.getAmount(), e.getCurrency()))
                                .status(e.getStatus())
                                .earnedAt(e.getEarnedAt())
                                .availableAt(e.getAvailableAt())
                                .build())
                        .toList())
                .build();
    }
}
