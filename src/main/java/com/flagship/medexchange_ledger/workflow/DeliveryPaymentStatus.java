package com.flagship.medexchange_ledger.workflow;

/**
 * Aggregate payment state of a delivery, derived from its two party payments.
 * Only PAYMENT_COMPLETE opens the delivery to couriers.
 */
public enum DeliveryPaymentStatus {
    AWAITING_PAYMENT,
    PARTIAL_PAYMENT,
    PAYMENT_COMPLETE,
    RELEASED_TO_COURIER,
    REFUNDED
}
