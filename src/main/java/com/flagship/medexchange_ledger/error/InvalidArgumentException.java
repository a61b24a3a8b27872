package com.flagship.medexchange_ledger.error;

public class InvalidArgumentException extends LedgerException {

    public InvalidArgumentException(String message) {
        super(ErrorCode.INVALID_ARGUMENT, message);
    }
}
