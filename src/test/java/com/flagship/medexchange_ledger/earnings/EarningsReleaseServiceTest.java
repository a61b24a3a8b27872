package com.flagship.medexchange_ledger.earnings;

import com.flagship.medexchange_ledger.IntegrationTestSupport;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EarningsReleaseServiceTest extends IntegrationTestSupport {

    @Autowired
    private EarningsService earningsService;

    @Autowired
    private EarningsReleaseService releaseService;

    @Autowired
    private CourierWalletService courierWalletService;

    @Autowired
    private CourierEarningRepository earningRepository;

    @Test
    @DisplayName("An earning keeps the commission back and lands in pending")
    void recordEarningHoldsNetAmount() {
        String courierId = uniqueId("courier");
        UUID deliveryId = UUID.randomUUID();

        CourierEarningEntity earning = earningsService.recordEarning(deliveryId, courierId, 5000, CurrencyCode.XOF);

        assertEquals(750, earning.getCommission());
        assertEquals(4250, earning.getAmount());
        assertEquals(CourierEarningStatus.PENDING, earning.getStatus());

        CourierWalletEntity wallet = courierWalletService.find(courierId).orElseThrow();
        assertEquals(4250, wallet.getPending());
        assertEquals(4250, wallet.getBalance());
        assertEquals(0, wallet.getAvailable());
    }

    @Test
    void recordEarningIsIdempotentPerDelivery() {
        String courierId = uniqueId("courier");
        UUID deliveryId = UUID.randomUUID();

        CourierEarningEntity first = earningsService.recordEarning(deliveryId, courierId, 5000, CurrencyCode.XOF);
        CourierEarningEntity second = earningsService.recordEarning(deliveryId, courierId, 5000, CurrencyCode.XOF);

        assertEquals(first.getId(), second.getId());
        assertEquals(4250, courierWalletService.find(courierId).orElseThrow().getBalance());
    }

    @Test
    @DisplayName("Earnings mature only after the hold period and are released once")
    void releaseRespectsHoldPeriod() {
        String courierId = uniqueId("courier");
        UUID deliveryId = UUID.randomUUID();
        earningsService.recordEarning(deliveryId, courierId, 5000, CurrencyCode.XOF);
        Instant now = Instant.now();

        releaseService.releaseAllMatured(now.plus(Duration.ofHours(23)));
        CourierWalletEntity early = courierWalletService.find(courierId).orElseThrow();
        assertEquals(4250, early.getPending());
        assertEquals(0, early.getAvailable());

        ReleaseSummary summary = releaseService.releaseAllMatured(now.plus(Duration.ofHours(25)));
        assertTrue(summary.earnings() >= 1);
        assertTrue(summary.failedCouriers().isEmpty());

        CourierWalletEntity released = courierWalletService.find(courierId).orElseThrow();
        assertEquals(0, released.getPending());
        assertEquals(4250, released.getAvailable());
        assertEquals(4250, released.getBalance());
        assertEquals(CourierEarningStatus.AVAILABLE,
                earningRepository.findByDeliveryId(deliveryId).orElseThrow().getStatus());

        releaseService.releaseAllMatured(now.plus(Duration.ofHours(26)));
        assertEquals(4250, courierWalletService.find(courierId).orElseThrow().getAvailable());
    }

    @Test
    void rejectsDeliveryWithoutFee() {
        assertThrows(InvalidArgumentException.class,
                () -> earningsService.recordEarning(UUID.randomUUID(), uniqueId("courier"), 0, CurrencyCode.XOF));
    }
}
