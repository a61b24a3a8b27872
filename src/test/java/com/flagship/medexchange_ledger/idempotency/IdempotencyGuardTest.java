package com.flagship.medexchange_ledger.idempotency;

import com.flagship.medexchange_ledger.IntegrationTestSupport;
import com.flagship.medexchange_ledger.ledger.LedgerEntry;
import com.flagship.medexchange_ledger.ledger.LedgerEntryType;
import com.flagship.medexchange_ledger.ledger.LedgerReference;
import com.flagship.medexchange_ledger.ledger.PostingRequest;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyGuardTest extends IntegrationTestSupport {

    @Autowired
    private IdempotencyGuard guard;

    @Test
    void secondRunIsSkipped() {
        IdempotencyKey key = IdempotencyKey.notification("flutterwave", uniqueId("flw"), "charge.completed");
        AtomicInteger calls = new AtomicInteger();

        Optional<Integer> first = transactionTemplate.execute(status ->
                guard.runOnce(key, Map.of("attempt", 1), calls::incrementAndGet));
        Optional<Integer> second = transactionTemplate.execute(status ->
                guard.runOnce(key, Map.of("attempt", 2), calls::incrementAndGet));

        assertEquals(Optional.of(1), first);
        assertEquals(Optional.empty(), second);
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("A rolled-back effect leaves the key unmarked")
    void rollbackUnmarks() {
        IdempotencyKey key = IdempotencyKey.workflowEvent(UUID.randomUUID(), "guard-test");

        assertThrows(IllegalStateException.class, () -> transactionTemplate.execute(status ->
                guard.runOnce(key, Map.of(), () -> {
                    throw new IllegalStateException("effect failed");
                })));

        Boolean processed = transactionTemplate.execute(status -> guard.check(key));
        assertEquals(Boolean.FALSE, processed);
    }

    @Test
    void refusesToRunOutsideTransaction() {
        IdempotencyKey key = IdempotencyKey.workflowEvent(UUID.randomUUID(), "guard-test");

        assertThrows(IllegalTransactionStateException.class, () -> guard.runOnce(key, Map.of(), () -> 1));
    }

    @Test
    @DisplayName("Concurrent attempts on one key credit the wallet exactly once")
    void concurrentAttemptsApplyOnce() throws InterruptedException {
        String userId = uniqueId("pharmacy");
        fundWallet(userId, CurrencyCode.XOF, 0);
        IdempotencyKey key = IdempotencyKey.notification("flutterwave", uniqueId("flw"), "charge.completed");

        int threadCount = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger applied = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();
        AtomicInteger lostRace = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    Optional<LedgerEntry> result = transactionTemplate.execute(status ->
                            guard.runOnce(key, Map.of("userId", userId), () -> ledgerService.credit(
                                    PostingRequest.builder()
                                            .userId(userId)
                                            .amount(1000)
                                            .currency(CurrencyCode.XOF)
                                            .type(LedgerEntryType.TOPUP)
                                            .description("Concurrent top-up")
                                            .reference(LedgerReference.of(LedgerReference.TOPUP_REQUEST, key.value()))
                                            .build())));
                    if (result != null && result.isPresent()) {
                        applied.incrementAndGet();
                    } else {
                        skipped.incrementAndGet();
                    }
                } catch (DuplicateOperationException e) {
                    lostRace.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, applied.get());
        assertEquals(threadCount - 1, skipped.get() + lostRace.get());
        assertEquals(1000L, balanceOf(userId));
    }
}
