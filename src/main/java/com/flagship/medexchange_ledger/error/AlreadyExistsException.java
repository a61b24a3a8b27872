package com.flagship.medexchange_ledger.error;

public class AlreadyExistsException extends LedgerException {

    public AlreadyExistsException(String message) {
        super(ErrorCode.ALREADY_EXISTS, message);
    }
}
