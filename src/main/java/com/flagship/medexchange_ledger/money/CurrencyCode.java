package com.flagship.medexchange_ledger.money;

import java.util.Locale;
import java.util.Optional;

/**
 * Currencies the marketplace settles in, with the number of decimal places
 * of their smallest unit (ISO-4217 minor unit exponent).
 *
 * Amounts are stored as {@code long} counts of the smallest unit. Zero-decimal
 * currencies (XOF, XAF, GNF, UGX, RWF) store the display amount as-is.
 */
public enum CurrencyCode {
    XOF(0), // West African CFA franc
    XAF(0), // Central African CFA franc
    GNF(0), // Guinean franc
    UGX(0), // Ugandan shilling
    RWF(0), // Rwandan franc
    NGN(2), // Nigerian naira
    GHS(2), // Ghanaian cedi
    KES(2), // Kenyan shilling
    TZS(2), // Tanzanian shilling
    BWP(2), // Botswana pula
    ZAR(2), // South African rand
    USD(2),
    EUR(2);

    private final int exponent;

    CurrencyCode(int exponent) {
        this.exponent = exponent;
    }

    public int getExponent() {
        return exponent;
    }

    public boolean isZeroDecimal() {
        return exponent == 0;
    }

    /**
     * Lenient lookup for codes coming from clients and the payment provider.
     */
    public static Optional<CurrencyCode> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
