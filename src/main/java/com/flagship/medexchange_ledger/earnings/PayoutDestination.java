package com.flagship.medexchange_ledger.earnings;

import com.flagship.medexchange_ledger.error.InvalidArgumentException;

public enum PayoutDestination {
    MOBILE_MONEY("mobile_money"),
    BANK_TRANSFER("bank_transfer");

    private final String wireValue;

    PayoutDestination(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static PayoutDestination fromWire(String value) {
        for (PayoutDestination destination : values()) {
            if (destination.wireValue.equalsIgnoreCase(value)) {
                return destination;
            }
        }
        throw new InvalidArgumentException("Unsupported payout destination: " + value);
    }
}
