package com.flagship.medexchange_ledger.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.medexchange_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Detects and records already-committed external operations.
 *
 * {@link #check} and {@link #mark} use MANDATORY propagation: they join the
 * transaction that applies the guarded effect, so check, effect and mark commit
 * or roll back together. If two invocations race past {@code check}, the primary
 * key on {@code idempotency_records} lets exactly one {@code mark} succeed; the
 * other raises {@link DuplicateOperationException} and its effect is rolled back.
 *
 * Redis holds a copy of committed keys as a fast path. It is written only after
 * commit and only ever answers "already processed"; a Redis miss or outage
 * falls through to the database, which stays the source of truth.
 */
@Service
@Slf4j
public class IdempotencyGuard {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final LedgerMetrics metrics;
    private final boolean cacheEnabled;

    public IdempotencyGuard(JdbcTemplate jdbcTemplate,
                            ObjectMapper objectMapper,
                            Optional<RedisTemplate<String, String>> redisTemplate,
                            LedgerMetrics metrics,
                            @Value("${idempotency.cache.enabled:true}") boolean cacheEnabled) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
        this.cacheEnabled = cacheEnabled;
    }

    /**
     * @return true if the operation identified by {@code key} has already committed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean check(IdempotencyKey key) {
        if (cachedAsProcessed(key)) {
            metrics.recordIdempotencyHit(key.operation());
            return true;
        }

        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM idempotency_records WHERE idempotency_key = ?",
            Integer.class,
            key.value()
        );
        boolean processed = count != null && count > 0;

        if (processed) {
            metrics.recordIdempotencyHit(key.operation());
            cacheAfterCommit(key);
        } else {
            metrics.recordIdempotencyMiss(key.operation());
        }
        return processed;
    }

    /**
     * Records that the guarded effect is part of the current transaction.
     *
     * @throws DuplicateOperationException if another transaction already marked the key
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void mark(IdempotencyKey key, Map<String, Object> metadata) {
        try {
            jdbcTemplate.update(
                "INSERT INTO idempotency_records (idempotency_key, operation, metadata, created_at) " +
                "VALUES (?, ?, CAST(? AS jsonb), CURRENT_TIMESTAMP)",
                key.value(),
                key.operation(),
                toJson(metadata)
            );
        } catch (DuplicateKeyException e) {
            log.info("Idempotency key {} was committed concurrently", key.value());
            throw new DuplicateOperationException(key);
        }
        cacheAfterCommit(key);
        log.debug("Marked idempotency key {}", key.value());
    }

    /**
     * Check, run and mark as one unit inside the caller's transaction.
     *
     * @return the effect's result, or empty when the key was already processed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public <T> Optional<T> runOnce(IdempotencyKey key, Map<String, Object> metadata, Supplier<T> effect) {
        if (check(key)) {
            log.info("Operation {} already processed, skipping", key.value());
            return Optional.empty();
        }
        T result = effect.get();
        mark(key, metadata);
        return Optional.ofNullable(result);
    }

    private boolean cachedAsProcessed(IdempotencyKey key) {
        if (!cacheEnabled || redisTemplate.isEmpty()) {
            return false;
        }
        try {
            return redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + key.value()) != null;
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    key.value(), e.getMessage());
            return false;
        }
    }

    private void cacheAfterCommit(IdempotencyKey key) {
        if (!cacheEnabled || redisTemplate.isEmpty() || !TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + key.value(), "1", REDIS_TTL);
                } catch (Exception e) {
                    // Database already holds the record
                    log.debug("Failed to cache idempotency key {}: {}", key.value(), e.getMessage());
                }
            }
        });
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Idempotency metadata is not serializable", e);
        }
    }
}
