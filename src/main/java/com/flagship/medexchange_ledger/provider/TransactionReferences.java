package com.flagship.medexchange_ledger.provider;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

/**
 * Caller-chosen references we hand to the provider, e.g. {@code NWM_TOPUP_1718000000000_A1B2C3D4E}.
 */
public final class TransactionReferences {

    public static final String TOPUP = "NWM_TOPUP";
    public static final String SUBSCRIPTION = "NWM_SUB";
    public static final String PAYOUT = "NWM_PAYOUT";

    private TransactionReferences() {
    }

    public static String next(String prefix, Clock clock) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 9).toUpperCase(Locale.ROOT);
        return prefix + "_" + clock.millis() + "_" + random;
    }
}
