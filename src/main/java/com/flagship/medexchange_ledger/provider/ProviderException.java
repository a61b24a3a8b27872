package com.flagship.medexchange_ledger.provider;

/**
 * The provider rejected a request or could not be reached.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
