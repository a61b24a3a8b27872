package com.flagship.medexchange_ledger.webhook;

/**
 * How a triaged provider callback ended. Only FAILED needs an operator.
 */
public enum NotificationOutcome {
    PROCESSED,
    DUPLICATE,
    IGNORED,
    FAILED
}
