package com.flagship.medexchange_ledger.money;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyNormalizerTest {

    @Test
    @DisplayName("Zero-decimal currencies keep the display amount as the stored amount")
    void zeroDecimalCurrencies() {
        assertEquals(1500L, MoneyNormalizer.toSmallestUnit(new BigDecimal("1500"), CurrencyCode.XOF));
        assertEquals(25000L, MoneyNormalizer.toSmallestUnit(new BigDecimal("25000"), CurrencyCode.UGX));
        assertEquals(new BigDecimal("1500"), MoneyNormalizer.fromSmallestUnit(1500, CurrencyCode.XAF));
    }

    @Test
    @DisplayName("Two-decimal currencies are stored in minor units")
    void twoDecimalCurrencies() {
        assertEquals(1250L, MoneyNormalizer.toSmallestUnit(new BigDecimal("12.50"), CurrencyCode.NGN));
        assertEquals(new BigDecimal("12.50"), MoneyNormalizer.fromSmallestUnit(1250, CurrencyCode.NGN));
    }

    @Test
    @DisplayName("Sub-unit precision rounds half-up")
    void roundsHalfUp() {
        assertEquals(1001L, MoneyNormalizer.toSmallestUnit(new BigDecimal("10.005"), CurrencyCode.KES));
        assertEquals(1000L, MoneyNormalizer.toSmallestUnit(new BigDecimal("10.004"), CurrencyCode.KES));
        assertEquals(2L, MoneyNormalizer.toSmallestUnit(new BigDecimal("1.5"), CurrencyCode.XOF));
    }

    @Test
    void formatsForDisplay() {
        assertEquals("1,500 XOF", MoneyNormalizer.formatForDisplay(1500, CurrencyCode.XOF));
        assertEquals("12.50 NGN", MoneyNormalizer.formatForDisplay(1250, CurrencyCode.NGN));
    }

    @Test
    @DisplayName("Validation reports the first failing rule")
    void validatesAmounts() {
        assertEquals(AmountValidation.Failure.MISSING,
                MoneyNormalizer.validateAmount(null, CurrencyCode.XOF, null, null).failure());
        assertEquals(AmountValidation.Failure.NOT_POSITIVE,
                MoneyNormalizer.validateAmount(BigDecimal.ZERO, CurrencyCode.XOF, null, null).failure());
        assertEquals(AmountValidation.Failure.TOO_MANY_DECIMALS,
                MoneyNormalizer.validateAmount(new BigDecimal("10.5"), CurrencyCode.XOF, null, null).failure());
        assertEquals(AmountValidation.Failure.BELOW_MINIMUM,
                MoneyNormalizer.validateAmount(new BigDecimal("50"), CurrencyCode.XOF, new BigDecimal("100"), null).failure());
        assertEquals(AmountValidation.Failure.ABOVE_MAXIMUM,
                MoneyNormalizer.validateAmount(new BigDecimal("5000"), CurrencyCode.XOF, null, new BigDecimal("1000")).failure());

        AmountValidation valid = MoneyNormalizer.validateAmount(new BigDecimal("12.50"), CurrencyCode.NGN,
                new BigDecimal("1"), new BigDecimal("100"));
        assertTrue(valid.isValid());
        assertNull(valid.message());
    }

    @Test
    void decimalMessageNamesTheCurrencyRule() {
        assertEquals("XOF amounts must be whole numbers",
                MoneyNormalizer.validateAmount(new BigDecimal("10.5"), CurrencyCode.XOF, null, null).message());
        assertEquals("NGN supports at most 2 decimal places",
                MoneyNormalizer.validateAmount(new BigDecimal("10.555"), CurrencyCode.NGN, null, null).message());
    }

    @Test
    @DisplayName("Trailing zeros do not count as extra decimals")
    void trailingZerosAreNotDecimals() {
        assertTrue(MoneyNormalizer.validateAmount(new BigDecimal("1500.00"), CurrencyCode.XOF, null, null).isValid());
    }

    @Test
    void calculatesCappedFees() {
        assertEquals(150L, MoneyNormalizer.calculateFee(1000, new BigDecimal("15"), null));
        assertEquals(10L, MoneyNormalizer.calculateFee(1000, new BigDecimal("1.0"), null));
        assertEquals(2L, MoneyNormalizer.calculateFee(150, new BigDecimal("1.0"), null));
        assertEquals(500L, MoneyNormalizer.calculateFee(100_000, new BigDecimal("1.0"), 500L));
        assertEquals(0L, MoneyNormalizer.calculateFee(0, new BigDecimal("15"), null));
        assertThrows(IllegalArgumentException.class, () -> MoneyNormalizer.calculateFee(-1, BigDecimal.ONE, null));
        assertThrows(IllegalArgumentException.class, () -> MoneyNormalizer.calculateFee(100, new BigDecimal("-1"), null));
    }

    @Test
    void resolvesCurrencyCodes() {
        assertEquals(CurrencyCode.GHS, CurrencyCode.fromCode("ghs").orElseThrow());
        assertTrue(CurrencyCode.fromCode("BTC").isEmpty());
        assertTrue(CurrencyCode.fromCode(null).isEmpty());
    }
}
