package com.flagship.medexchange_ledger.error;

import lombok.Getter;

/**
 * Base class for typed failures surfaced to callers.
 * The {@link ErrorCode} decides the HTTP status in {@link GlobalExceptionHandler}.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode code;

    protected LedgerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
