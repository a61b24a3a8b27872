package com.flagship.medexchange_ledger.idempotency;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Deduplication token: an operation name plus the business key that scopes it.
 *
 * Externally triggered operations use the external transaction id; periodic
 * operations add a period key (e.g. the calendar day of a subscription charge).
 */
public record IdempotencyKey(String operation, String key) {

    public static final String PAYMENT_NOTIFICATION = "payment_notification";
    public static final String SUBSCRIPTION_WALLET_PAYMENT = "subscription_wallet_payment";
    public static final String WORKFLOW_EVENT = "workflow_event";

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    public IdempotencyKey {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("Idempotency operation cannot be blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }
    }

    /**
     * Provider callback: one effect per (provider, transaction, event type).
     */
    public static IdempotencyKey notification(String provider, String providerTxId, String eventType) {
        return new IdempotencyKey(PAYMENT_NOTIFICATION, provider + "_" + providerTxId + "_" + eventType);
    }

    /**
     * Wallet-funded subscription: at most one charge per user, plan and day.
     */
    public static IdempotencyKey walletSubscription(String userId, String planId, LocalDate day) {
        return new IdempotencyKey(SUBSCRIPTION_WALLET_PAYMENT,
                "wallet_subscription_" + userId + "_" + planId + "_" + DAY.format(day));
    }

    public static IdempotencyKey workflowEvent(UUID eventId, String consumerGroup) {
        return new IdempotencyKey(WORKFLOW_EVENT, consumerGroup + "_" + eventId);
    }

    /**
     * The stored primary key.
     */
    public String value() {
        return operation + "_" + key;
    }
}
