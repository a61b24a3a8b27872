package com.flagship.medexchange_ledger.money;

/**
 * Outcome of {@link MoneyNormalizer#validateAmount}. A failed validation
 * carries the reason and a message suitable for the caller.
 */
public record AmountValidation(Failure failure, String message) {

    public enum Failure {
        MISSING,
        NOT_POSITIVE,
        TOO_MANY_DECIMALS,
        BELOW_MINIMUM,
        ABOVE_MAXIMUM
    }

    private static final AmountValidation VALID = new AmountValidation(null, null);

    public static AmountValidation valid() {
        return VALID;
    }

    public static AmountValidation failed(Failure failure, String message) {
        return new AmountValidation(failure, message);
    }

    public boolean isValid() {
        return failure == null;
    }
}
