package com.flagship.medexchange_ledger.error;

/**
 * The request is well formed but the current state forbids it: wrong workflow
 * state, currency mismatch, not enough funds.
 */
public class FailedPreconditionException extends LedgerException {

    public FailedPreconditionException(String message) {
        super(ErrorCode.FAILED_PRECONDITION, message);
    }
}
