package com.flagship.medexchange_ledger.ledger;

/**
 * The business object a ledger entry settles, e.g. {@code ("topup_request", txRef)}.
 */
public record LedgerReference(String type, String id) {

    public static final String TOPUP_REQUEST = "topup_request";
    public static final String SUBSCRIPTION = "subscription";
    public static final String DELIVERY = "delivery";

    public static LedgerReference of(String type, Object id) {
        return new LedgerReference(type, String.valueOf(id));
    }
}
