package com.flagship.medexchange_ledger.observability;

import com.flagship.medexchange_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks. Redis only carries the idempotency fast path, so its
 * outage degrades rather than fails the service.
 */
public class HealthIndicators {

    private static final String REDIS_FALLBACK_NOTE = "Idempotency checks fall back to the database";

    /**
     * Unpublished workflow events. A growing backlog means deliveries and
     * earnings are not being created.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                Health.Builder builder = backlog < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlog < BACKLOG_CRITICAL_THRESHOLD ? Health.status("WARNING") : Health.down();
                return builder
                        .withDetail("backlogSize", backlog)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", REDIS_FALLBACK_NOTE)
                        .build();
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String response = connection.ping();
                return "PONG".equals(response)
                        ? Health.up().withDetail("response", response).build()
                        : Health.status("DEGRADED").withDetail("response", String.valueOf(response))
                                .withDetail("note", REDIS_FALLBACK_NOTE).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", REDIS_FALLBACK_NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down().withDetail("error", "No Kafka producer connections").build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Money that is stuck: notifications flagged for manual reconciliation and
     * earnings the release job has not picked up. Reported from the cached
     * gauges; never fails readiness.
     */
    @Component("settlementHealth")
    public static class SettlementHealthIndicator implements HealthIndicator {

        private final OperationalGauges gauges;

        public SettlementHealthIndicator(OperationalGauges gauges) {
            this.gauges = gauges;
        }

        @Override
        public Health health() {
            long toReconcile = gauges.notificationsToReconcile();
            long overdue = gauges.overdueEarnings();
            Health.Builder builder = toReconcile == 0 && overdue == 0 ? Health.up() : Health.status("WARNING");
            return builder
                    .withDetail("notificationsToReconcile", toReconcile)
                    .withDetail("overdueEarnings", overdue)
                    .build();
        }
    }
}
