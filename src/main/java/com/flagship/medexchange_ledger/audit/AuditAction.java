package com.flagship.medexchange_ledger.audit;

public enum AuditAction {
    TOPUP_INITIATED,
    TOPUP_COMPLETED,
    TOPUP_FAILED,
    SUBSCRIPTION_ACTIVATED,
    SUBSCRIPTION_PAYMENT_REQUESTED,
    SUBSCRIPTION_PAYMENT_COMPLETED,
    SUBSCRIPTION_PAYMENT_FAILED,
    EARNING_CREATED,
    EARNINGS_RELEASED,
    PAYOUT_REQUESTED,
    PAYOUT_COMPLETED,
    PAYOUT_REVERTED,
    DELIVERY_CREATED,
    DELIVERY_PAID,
    DELIVERY_REFUNDED,
    DELIVERY_TRANSITIONED,
    EXCHANGE_CREATED,
    EXCHANGE_TRANSITIONED,
    COURIER_REGISTERED,
    ADMIN_OVERRIDE
}
