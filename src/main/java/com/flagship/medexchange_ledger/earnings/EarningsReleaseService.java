package com.flagship.medexchange_ledger.earnings;

import com.flagship.medexchange_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Moves matured earnings from pending to available.
 *
 * A run selects at most {@code earnings.release-batch-size} PENDING earnings
 * whose {@code earnedAt} is at least the release delay in the past, groups them
 * by courier and releases each group in its own transaction. One courier's
 * failure does not stop the others; its earnings stay PENDING for the next run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EarningsReleaseService {

    private final CourierEarningRepository earningRepository;
    private final CourierWalletService walletService;
    private final EarningsProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public ReleaseSummary releaseMaturedEarnings() {
        return releaseMaturedEarnings(clock.instant());
    }

    /**
     * Releases one bounded batch of earnings matured as of {@code asOf}.
     */
    public ReleaseSummary releaseMaturedEarnings(Instant asOf) {
        long start = System.currentTimeMillis();
        Instant cutoff = asOf.minus(properties.getReleaseDelay());

        List<CourierEarningEntity> batch = earningRepository.findMatured(
                CourierEarningStatus.PENDING, cutoff, PageRequest.of(0, properties.getReleaseBatchSize()));
        if (batch.isEmpty()) {
            log.debug("No matured earnings as of {}", asOf);
            return ReleaseSummary.empty();
        }

        Map<String, List<UUID>> byCourier = new LinkedHashMap<>();
        for (CourierEarningEntity earning : batch) {
            byCourier.computeIfAbsent(earning.getCourierId(), id -> new ArrayList<>()).add(earning.getId());
        }

        int couriers = 0;
        int released = 0;
        List<String> failed = new ArrayList<>();
        for (Map.Entry<String, List<UUID>> group : byCourier.entrySet()) {
            try {
                int count = walletService.releaseForCourier(group.getKey(), group.getValue(), asOf);
                if (count > 0) {
                    couriers++;
                    released += count;
                }
            } catch (RuntimeException e) {
                log.error("Failed to release earnings for courier {}: {}", group.getKey(), e.getMessage(), e);
                failed.add(group.getKey());
            }
        }

        metrics.recordEarningsReleased(couriers, released);
        metrics.recordReleaseDuration(System.currentTimeMillis() - start);
        log.info("Earnings release as of {}: {} earnings for {} couriers, {} failed",
                asOf, released, couriers, failed.size());
        return new ReleaseSummary(couriers, released, List.copyOf(failed));
    }

    /**
     * Administrative re-run: keeps releasing batches until one comes back short
     * or releases nothing.
     */
    public ReleaseSummary releaseAllMatured(Instant asOf) {
        ReleaseSummary total = ReleaseSummary.empty();
        while (true) {
            ReleaseSummary run = releaseMaturedEarnings(asOf);
            total = total.plus(run);
            if (run.earnings() == 0 || run.earnings() < properties.getReleaseBatchSize()) {
                return total;
            }
        }
    }
}
