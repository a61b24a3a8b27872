package com.flagship.medexchange_ledger.error;

/**
 * Provider or infrastructure failure. The message is safe to show; the cause is logged only.
 */
public class InternalException extends LedgerException {

    public InternalException(String message) {
        super(ErrorCode.INTERNAL, message);
    }

    public InternalException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL, message, cause);
    }
}
