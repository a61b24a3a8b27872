package com.flagship.medexchange_ledger.workflow;

public enum ExchangeStatus {
    DRAFT,
    PENDING,
    ACCEPTED,
    REJECTED,
    IN_TRANSIT,
    COMPLETED
}
