package com.flagship.medexchange_ledger.subscription;

import com.flagship.medexchange_ledger.error.InvalidArgumentException;

/**
 * How a plan activation is paid for. FREE is implied by the plan tier, never requested.
 */
public enum SubscriptionFunding {
    FREE,
    WALLET,
    EXTERNAL;

    public static SubscriptionFunding fromWire(String value) {
        if ("wallet".equalsIgnoreCase(value)) {
            return WALLET;
        }
        if ("external".equalsIgnoreCase(value)) {
            return EXTERNAL;
        }
        throw new InvalidArgumentException("Invalid payment method: " + value);
    }
}
