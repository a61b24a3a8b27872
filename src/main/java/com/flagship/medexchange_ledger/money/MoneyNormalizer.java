package com.flagship.medexchange_ledger.money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Currency-aware conversion between display amounts and integer smallest-unit
 * amounts, plus fee arithmetic.
 *
 * All conversions round half-up to the nearest smallest unit. Nothing here
 * touches the database or the network.
 */
public final class MoneyNormalizer {

    private MoneyNormalizer() {
    }

    /**
     * Converts a display amount (e.g. 12.50 NGN) to smallest units (1250).
     */
    public static long toSmallestUnit(BigDecimal displayAmount, CurrencyCode currency) {
        if (displayAmount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        return displayAmount
                .movePointRight(currency.getExponent())
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    public static BigDecimal fromSmallestUnit(long amount, CurrencyCode currency) {
        return BigDecimal.valueOf(amount, currency.getExponent());
    }

    /**
     * Renders an amount for humans, e.g. {@code "1,500 XOF"} or {@code "12.50 NGN"}.
     */
    public static String formatForDisplay(long amount, CurrencyCode currency) {
        NumberFormat format = NumberFormat.getNumberInstance(Locale.US);
        format.setMinimumFractionDigits(currency.getExponent());
        format.setMaximumFractionDigits(currency.getExponent());
        return format.format(fromSmallestUnit(amount, currency)) + " " + currency.name();
    }

    /**
     * Checks a display amount against the currency's precision and an inclusive
     * [min, max] range expressed in display units. Either bound may be null.
     */
    public static AmountValidation validateAmount(BigDecimal amount, CurrencyCode currency,
                                                  BigDecimal min, BigDecimal max) {
        if (amount == null) {
            return AmountValidation.failed(AmountValidation.Failure.MISSING, "Amount is required");
        }
        if (amount.signum() <= 0) {
            return AmountValidation.failed(AmountValidation.Failure.NOT_POSITIVE,
                    "Amount must be a positive number");
        }
        if (amount.stripTrailingZeros().scale() > currency.getExponent()) {
            return AmountValidation.failed(AmountValidation.Failure.TOO_MANY_DECIMALS, currency.isZeroDecimal()
                    ? String.format("%s amounts must be whole numbers", currency)
                    : String.format("%s supports at most %d decimal places", currency, currency.getExponent()));
        }
        if (min != null && amount.compareTo(min) < 0) {
            return AmountValidation.failed(AmountValidation.Failure.BELOW_MINIMUM,
                    String.format("Minimum amount is %s %s", min.toPlainString(), currency));
        }
        if (max != null && amount.compareTo(max) > 0) {
            return AmountValidation.failed(AmountValidation.Failure.ABOVE_MAXIMUM,
                    String.format("Maximum amount is %s %s", max.toPlainString(), currency));
        }
        return AmountValidation.valid();
    }

    /**
     * Percentage fee on a smallest-unit amount, rounded half-up, optionally capped.
     *
     * @param cap maximum fee in smallest units, or null for no cap
     */
    public static long calculateFee(long amount, BigDecimal feePercent, Long cap) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount cannot be negative");
        }
        if (feePercent == null || feePercent.signum() < 0) {
            throw new IllegalArgumentException("Fee percent must be zero or positive");
        }
        long fee = BigDecimal.valueOf(amount)
                .multiply(feePercent)
                .divide(BigDecimal.valueOf(100), 0, RoundingMode.HALF_UP)
                .longValueExact();
        return cap != null ? Math.min(fee, cap) : fee;
    }
}
