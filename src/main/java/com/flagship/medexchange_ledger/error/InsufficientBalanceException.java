package com.flagship.medexchange_ledger.error;

import lombok.Getter;

@Getter
public class InsufficientBalanceException extends FailedPreconditionException {

    private final long balance;
    private final long requested;

    public InsufficientBalanceException(String ownerId, long balance, long requested) {
        super(String.format("Insufficient balance for %s: balance=%d, requested=%d", ownerId, balance, requested));
        this.balance = balance;
        this.requested = requested;
    }
}
