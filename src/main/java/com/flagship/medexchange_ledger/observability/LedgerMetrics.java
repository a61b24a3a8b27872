package com.flagship.medexchange_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for money movement and workflow transitions.
 *
 * Metrics exposed:
 * - ledger.postings{type,direction,status}: wallet debits and credits
 * - webhook.notifications{event,outcome}: triage results of provider callbacks
 * - idempotency.checks{operation,result}: hit = already processed
 * - earnings.released / earnings.release.duration: maturation job output
 * - courier.payouts{status}: payout lifecycle
 * - workflow.transitions{workflow,to}: accepted state changes
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer releaseTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.releaseTimer = Timer.builder("earnings.release.duration")
                .description("Time taken by one earnings maturation run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordPosting(String type, String direction, String status) {
        registry.counter("ledger.postings",
                "type", sanitizeTag(type),
                "direction", sanitizeTag(direction),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordNotification(String eventType, String outcome) {
        registry.counter("webhook.notifications",
                "event", sanitizeTag(eventType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordIdempotencyHit(String operation) {
        registry.counter("idempotency.checks", "operation", sanitizeTag(operation), "result", "hit").increment();
    }

    public void recordIdempotencyMiss(String operation) {
        registry.counter("idempotency.checks", "operation", sanitizeTag(operation), "result", "miss").increment();
    }

    public void recordEarningsReleased(int couriers, int earnings) {
        registry.counter("earnings.released", "unit", "courier").increment(couriers);
        registry.counter("earnings.released", "unit", "earning").increment(earnings);
    }

    public void recordReleaseDuration(long durationMs) {
        releaseTimer.record(Duration.ofMillis(durationMs));
    }

    public void recordPayout(String status) {
        registry.counter("courier.payouts", "status", sanitizeTag(status)).increment();
    }

    public void recordTransition(String workflow, String toStatus) {
        registry.counter("workflow.transitions",
                "workflow", sanitizeTag(workflow),
                "to", sanitizeTag(toStatus)
        ).increment();
    }

    public void recordProviderLatency(String operation, long durationMs) {
        registry.timer("provider.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
