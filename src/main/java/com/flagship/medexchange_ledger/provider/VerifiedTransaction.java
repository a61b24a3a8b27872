package com.flagship.medexchange_ledger.provider;

import java.math.BigDecimal;

/**
 * The provider's own view of a transaction, fetched from its query API.
 */
public record VerifiedTransaction(String providerTxId, String txRef, String status,
                                  BigDecimal amount, String currency) {

    public static final String SUCCESSFUL = "successful";

    public boolean isSuccessful() {
        return SUCCESSFUL.equalsIgnoreCase(status);
    }
}
