package com.flagship.medexchange_ledger.ledger;

import com.flagship.medexchange_ledger.money.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable row of the party ledger.
 *
 * {@code balanceAfter} is the wallet balance right after a COMPLETED entry was
 * applied; it is null for entries that did not move money.
 */
@Value
public class LedgerEntry {
    UUID id;
    String userId;
    LedgerEntryType type;
    long amount;
    CurrencyCode currency;
    LedgerEntryStatus status;
    String description;
    String referenceType;
    String referenceId;
    Long balanceAfter;
    String metadata;
    Instant createdAt;
    Long sequenceNumber;
}
