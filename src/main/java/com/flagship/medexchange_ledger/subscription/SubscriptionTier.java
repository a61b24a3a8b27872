package com.flagship.medexchange_ledger.subscription;

public enum SubscriptionTier {
    FREE,
    BASIC,
    PREMIUM,
    ENTERPRISE
}
