package com.flagship.medexchange_ledger.topup;

import com.flagship.medexchange_ledger.error.InvalidArgumentException;

/**
 * How a party funds a wallet top-up or an external subscription payment.
 * Wire values are lower snake case ({@code mobile_money}, {@code card}).
 */
public enum PaymentMethod {
    MOBILE_MONEY("mobile_money"),
    CARD("card");

    private final String wireValue;

    PaymentMethod(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static PaymentMethod fromWire(String value) {
        for (PaymentMethod method : values()) {
            if (method.wireValue.equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new InvalidArgumentException("Unsupported payment method: " + value);
    }
}
