package com.flagship.medexchange_ledger.earnings;

/**
 * PENDING until the release window passes, AVAILABLE once matured, PAID_OUT
 * when a completed payout covers it.
 */
public enum CourierEarningStatus {
    PENDING,
    AVAILABLE,
    PAID_OUT,
    CANCELLED
}
