package com.flagship.medexchange_ledger.ledger;

/**
 * Only COMPLETED entries correspond to a balance change. PENDING, FAILED and
 * CANCELLED entries document the life of a request (e.g. a top-up) without
 * moving money.
 */
public enum LedgerEntryStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED
}
