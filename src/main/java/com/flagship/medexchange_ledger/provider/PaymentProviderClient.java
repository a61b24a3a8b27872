package com.flagship.medexchange_ledger.provider;

/**
 * Boundary to the external payment gateway. Implementations throw
 * {@link ProviderException} on rejection, transport error or timeout.
 */
public interface PaymentProviderClient {

    /**
     * Short provider name used in idempotency keys and receipts.
     */
    String name();

    /**
     * Re-reads a transaction from the provider. A callback is not enough
     * authority to credit a wallet; this answer is.
     */
    VerifiedTransaction verifyTransaction(String providerTxId);

    ChargeResult chargeMobileMoney(ChargeRequest request);

    /**
     * Hosted checkout link, used for card payments.
     */
    ChargeResult createPaymentLink(ChargeRequest request);

    TransferResult initiateTransfer(TransferRequest request);
}
