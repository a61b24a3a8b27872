package com.flagship.medexchange_ledger.ledger;

import com.flagship.medexchange_ledger.money.CurrencyCode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Input of a single ledger posting. {@code amount} is in smallest currency units.
 */
@Value
@Builder
public class PostingRequest {
    String userId;
    long amount;
    CurrencyCode currency;
    LedgerEntryType type;
    String description;
    LedgerReference reference;
    @Singular("meta")
    Map<String, Object> metadata;
}
