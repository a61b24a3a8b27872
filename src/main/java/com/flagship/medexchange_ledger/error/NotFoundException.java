package com.flagship.medexchange_ledger.error;

public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
