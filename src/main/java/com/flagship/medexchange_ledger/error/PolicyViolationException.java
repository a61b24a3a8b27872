package com.flagship.medexchange_ledger.error;

/**
 * Raised by the persistence-level write policy when an entity change breaks
 * an ownership or transition rule, whatever code path produced it.
 */
public class PolicyViolationException extends PermissionDeniedException {

    public PolicyViolationException(String message) {
        super(message);
    }
}
