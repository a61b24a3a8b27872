package com.flagship.medexchange_ledger.observability;

import com.flagship.medexchange_ledger.outbox.OutboxEventRepository;
import com.flagship.medexchange_ledger.webhook.NotificationReceiptService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Backlog gauges that need database queries. Values are cached and refreshed
 * by {@link MetricsScheduler} so a scrape never hits the database.
 *
 * <ul>
 *   <li>outbox backlog, age of its oldest event, dead letters</li>
 *   <li>courier earnings past their release time but still pending</li>
 *   <li>payment notifications flagged for reconciliation</li>
 * </ul>
 */
@Component
@Slf4j
public class OperationalGauges {

    private final OutboxEventRepository outboxRepository;
    private final NotificationReceiptService receiptService;
    private final JdbcTemplate jdbcTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final AtomicLong outboxBacklog = new AtomicLong();
    private final AtomicLong outboxOldestAgeSeconds = new AtomicLong();
    private final AtomicLong outboxDeadLetters = new AtomicLong();
    private final AtomicLong overdueEarnings = new AtomicLong();
    private final AtomicLong notificationsToReconcile = new AtomicLong();

    public OperationalGauges(OutboxEventRepository outboxRepository,
                             NotificationReceiptService receiptService,
                             JdbcTemplate jdbcTemplate,
                             MeterRegistry meterRegistry,
                             Clock clock,
                             @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.receiptService = receiptService;
        this.jdbcTemplate = jdbcTemplate;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", outboxBacklog, AtomicLong::get)
                .description("Unpublished workflow events")
                .register(meterRegistry);
        Gauge.builder("outbox.backlog.age.seconds", outboxOldestAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished workflow event")
                .register(meterRegistry);
        Gauge.builder("outbox.events.failed", outboxDeadLetters, AtomicLong::get)
                .description("Workflow events past their retry limit")
                .register(meterRegistry);
        Gauge.builder("earnings.overdue", overdueEarnings, AtomicLong::get)
                .description("Pending courier earnings past their release time")
                .register(meterRegistry);
        Gauge.builder("notifications.reconciliation.pending", notificationsToReconcile, AtomicLong::get)
                .description("Payment notifications flagged for manual reconciliation")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refresh() {
        try {
            Instant now = clock.instant();
            outboxBacklog.set(outboxRepository.countUnpublished());
            outboxOldestAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, now).getSeconds()))
                    .orElse(0L));
            outboxDeadLetters.set(outboxRepository.countByRetryCountGreaterThanEqual(maxRetries));
            overdueEarnings.set(count(
                    "SELECT COUNT(*) FROM courier_earnings WHERE status = 'PENDING' AND available_at <= ?",
                    Timestamp.from(now)));
            notificationsToReconcile.set(receiptService.countAwaitingReconciliation());

            log.debug("Gauges refreshed: outboxBacklog={}, deadLetters={}, overdueEarnings={}, toReconcile={}",
                    outboxBacklog.get(), outboxDeadLetters.get(), overdueEarnings.get(), notificationsToReconcile.get());
        } catch (Exception e) {
            log.warn("Failed to refresh operational gauges: {}", e.getMessage());
        }
    }

    public long overdueEarnings() {
        return overdueEarnings.get();
    }

    public long notificationsToReconcile() {
        return notificationsToReconcile.get();
    }

    private long count(String sql, Object... args) {
        Long value = jdbcTemplate.queryForObject(sql, Long.class, args);
        return value == null ? 0 : value;
    }
}
