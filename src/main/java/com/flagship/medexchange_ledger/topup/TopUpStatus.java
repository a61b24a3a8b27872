package com.flagship.medexchange_ledger.topup;

public enum TopUpStatus {
    PENDING,
    COMPLETED,
    FAILED
}
