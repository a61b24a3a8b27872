package com.flagship.medexchange_ledger.earnings;

import java.util.EnumSet;
import java.util.Set;

public enum PayoutStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public static final Set<PayoutStatus> OPEN = EnumSet.of(PENDING, PROCESSING);

    public boolean isOpen() {
        return OPEN.contains(this);
    }
}
