package com.flagship.medexchange_ledger.error;

public class UnauthenticatedException extends LedgerException {

    public UnauthenticatedException(String message) {
        super(ErrorCode.UNAUTHENTICATED, message);
    }
}
