package com.flagship.medexchange_ledger.earnings;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Hourly maturation of courier earnings.
 *
 * Overlapping runs, here or on another instance, are harmless: each courier's
 * release re-checks PENDING under the wallet lock.
 */
@Component
@ConditionalOnProperty(name = "scheduler.earnings-release.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class EarningsReleaseScheduler {

    private final EarningsReleaseService releaseService;

    @Scheduled(cron = "${earnings.release-cron:0 0 * * * *}")
    public void releaseMaturedEarnings() {
        log.info("Starting scheduled earnings release");
        try {
            ReleaseSummary summary = releaseService.releaseMaturedEarnings();
            if (!summary.failedCouriers().isEmpty()) {
                log.warn("Earnings release left {} couriers for the next run", summary.failedCouriers().size());
            }
        } catch (RuntimeException e) {
            log.error("Scheduled earnings release failed", e);
        }
    }
}
