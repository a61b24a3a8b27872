package com.flagship.medexchange_ledger.idempotency;

import com.flagship.medexchange_ledger.error.AlreadyExistsException;

/**
 * A concurrent invocation committed the same guarded effect first.
 * The losing transaction is rolled back together with its effect.
 */
public class DuplicateOperationException extends AlreadyExistsException {

    public DuplicateOperationException(IdempotencyKey key) {
        super("Operation already processed: " + key.value());
    }
}
