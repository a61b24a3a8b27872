package com.flagship.medexchange_ledger.workflow;

public enum PartyPaymentStatus {
    PENDING,
    PAID,
    REFUNDED
}
