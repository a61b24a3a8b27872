package com.flagship.medexchange_ledger.error;

public class PermissionDeniedException extends LedgerException {

    public PermissionDeniedException(String message) {
        super(ErrorCode.PERMISSION_DENIED, message);
    }
}
