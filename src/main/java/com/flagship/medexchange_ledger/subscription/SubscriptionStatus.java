package com.flagship.medexchange_ledger.subscription;

public enum SubscriptionStatus {
    ACTIVE,
    EXPIRED,
    CANCELLED
}
