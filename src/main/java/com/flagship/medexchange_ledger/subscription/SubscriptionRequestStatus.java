package com.flagship.medexchange_ledger.subscription;

/**
 * A COMPLETED request is paid but not yet used; activating a plan with it
 * makes it CONSUMED.
 */
public enum SubscriptionRequestStatus {
    PENDING,
    COMPLETED,
    CONSUMED,
    FAILED
}
