package com.flagship.medexchange_ledger.earnings;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a maturation run. Couriers whose release failed are retried by the next run.
 */
public record ReleaseSummary(int couriers, int earnings, List<String> failedCouriers) {

    public static ReleaseSummary empty() {
        return new ReleaseSummary(0, 0, List.of());
    }

    public ReleaseSummary plus(ReleaseSummary other) {
        List<String> failed = new ArrayList<>(failedCouriers);
        failed.addAll(other.failedCouriers);
        return new ReleaseSummary(couriers + other.couriers, earnings + other.earnings, List.copyOf(failed));
    }
}
