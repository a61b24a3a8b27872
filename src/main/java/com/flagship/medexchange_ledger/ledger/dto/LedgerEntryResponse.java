package com.flagship.medexchange_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.ledger.LedgerEntry;
import com.flagship.medexchange_ledger.ledger.LedgerEntryStatus;
import com.flagship.medexchange_ledger.ledger.LedgerEntryType;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    LedgerEntryType type;

    @JsonProperty("status")
    LedgerEntryStatus status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference_type")
    String referenceType;

    @JsonProperty("reference_id")
    String referenceId;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
                .id(entry.getId())
                .type(entry.getType())
                .status(entry.getStatus())
                .amount(MoneyNormalizer.fromSmallestUnit(entry.getAmount(), entry.getCurrency()))
                .currency(entry.getCurrency().name())
                .description(entry.getDescription())
                .referenceType(entry.getReferenceType())
                .referenceId(entry.getReferenceId())
                .balanceAfter(entry.getBalanceAfter() == null ? null
                        : MoneyNormalizer.fromSmallestUnit(entry.getBalanceAfter(), entry.getCurrency()))
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
