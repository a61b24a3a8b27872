package com.flagship.medexchange_ledger.earnings;

import com.flagship.medexchange_ledger.IntegrationTestSupport;
import com.flagship.medexchange_ledger.earnings.dto.CreatePayoutRequest;
import com.flagship.medexchange_ledger.earnings.dto.PayoutResponse;
import com.flagship.medexchange_ledger.error.AlreadyExistsException;
import com.flagship.medexchange_ledger.error.InsufficientBalanceException;
import com.flagship.medexchange_ledger.error.InternalException;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.provider.ProviderException;
import com.flagship.medexchange_ledger.provider.TransferResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Payout reservation, provider hand-off and settlement against a courier
 * wallet holding 4,250 XOF available.
 */
class PayoutServiceTest extends IntegrationTestSupport {

    @Autowired
    private PayoutService payoutService;

    @Autowired
    private EarningsService earningsService;

    @Autowired
    private EarningsReleaseService releaseService;

    @Autowired
    private CourierWalletService courierWalletService;

    @Autowired
    private CourierPayoutRepository payoutRepository;

    private String courierId;

    @BeforeEach
    void setUp() {
        courierId = uniqueId("courier");
        earningsService.recordEarning(UUID.randomUUID(), courierId, 5000, CurrencyCode.XOF);
        releaseService.releaseAllMatured(Instant.now().plus(Duration.ofHours(25)));
        when(providerClient.initiateTransfer(any())).thenReturn(new TransferResult("flw-transfer-1", "NEW"));
    }

    @Test
    @DisplayName("A payout reserves the amount and charges the payout fee")
    void payoutReservesAvailable() {
        PayoutResponse response = payoutService.requestPayout(courierId, payout("2000"));

        assertEquals(PayoutStatus.PROCESSING, response.getStatus());
        assertEquals(0, new BigDecimal("20").compareTo(response.getFee()));
        assertEquals(0, new BigDecimal("1980").compareTo(response.getNetAmount()));

        CourierWalletEntity wallet = courierWalletService.find(courierId).orElseThrow();
        assertEquals(2250, wallet.getAvailable());
        assertEquals(4250, wallet.getBalance(), "balance drops only when the provider confirms");
    }

    @Test
    void onlyOnePayoutInFlight() {
        payoutService.requestPayout(courierId, payout("1000"));

        assertThrows(AlreadyExistsException.class, () -> payoutService.requestPayout(courierId, payout("1000")));
        assertEquals(3250, courierWalletService.find(courierId).orElseThrow().getAvailable());
    }

    @Test
    void cannotWithdrawMoreThanAvailable() {
        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
                () -> payoutService.requestPayout(courierId, payout("5000")));
        assertEquals(4250, e.getBalance());
        assertEquals(5000, e.getRequested());
    }

    @Test
    void belowMinimumRejected() {
        assertThrows(InvalidArgumentException.class, () -> payoutService.requestPayout(courierId, payout("500")));
    }

    @Test
    @DisplayName("A provider refusal restores the reservation and fails the payout")
    void providerRefusalCompensates() {
        when(providerClient.initiateTransfer(any())).thenThrow(new ProviderException("Insufficient float"));

        assertThrows(InternalException.class, () -> payoutService.requestPayout(courierId, payout("2000")));

        CourierWalletEntity wallet = courierWalletService.find(courierId).orElseThrow();
        assertEquals(4250, wallet.getAvailable());
        CourierPayoutEntity failed = payoutRepository.findTop20ByCourierIdOrderByRequestedAtDesc(courierId).get(0);
        assertEquals(PayoutStatus.FAILED, failed.getStatus());
    }

    @Test
    void confirmedTransferSettlesTheWallet() {
        PayoutResponse response = payoutService.requestPayout(courierId, payout("2000"));

        Boolean completed = transactionTemplate.execute(status ->
                payoutService.completePayout(response.getReference(), "flw-transfer-1"));
        Boolean repeated = transactionTemplate.execute(status ->
                payoutService.completePayout(response.getReference(), "flw-transfer-1"));

        assertTrue(completed);
        assertFalse(repeated);
        CourierWalletEntity wallet = courierWalletService.find(courierId).orElseThrow();
        assertEquals(2250, wallet.getBalance());
        assertEquals(2250, wallet.getAvailable());
        assertEquals(2000, wallet.getTotalPaidOut());
        assertEquals(PayoutStatus.COMPLETED, payoutRepository.findByReference(response.getReference())
                .orElseThrow().getStatus());

        CourierEarningEntity earning = onlyEarning();
        assertEquals(CourierEarningStatus.AVAILABLE, earning.getStatus());
        assertEquals(2000, earning.getPaidOutAmount());
        assertEquals(wallet.getAvailable() + wallet.getPending(), earning.getRemaining());
    }

    @Test
    @DisplayName("Payouts draw earnings down in parts until they are fully paid out")
    void partialPayoutsExhaustTheEarning() {
        settle(payoutService.requestPayout(courierId, payout("2000")));
        CourierEarningEntity afterFirst = onlyEarning();
        assertEquals(CourierEarningStatus.AVAILABLE, afterFirst.getStatus());
        assertEquals(2250, afterFirst.getRemaining());

        settle(payoutService.requestPayout(courierId, payout("2250")));

        CourierWalletEntity wallet = courierWalletService.find(courierId).orElseThrow();
        assertEquals(0, wallet.getAvailable());
        assertEquals(0, wallet.getPending());
        assertEquals(0, wallet.getBalance());
        assertEquals(4250, wallet.getTotalPaidOut());

        CourierEarningEntity earning = onlyEarning();
        assertEquals(CourierEarningStatus.PAID_OUT, earning.getStatus());
        assertEquals(4250, earning.getPaidOutAmount());
        assertNotNull(earning.getPaidOutAt());
    }

    @Test
    @DisplayName("A payout spanning two earnings pays out the oldest and draws on the next")
    void payoutSpansEarningsOldestFirst() {
        earningsService.recordEarning(UUID.randomUUID(), courierId, 5000, CurrencyCode.XOF);
        releaseService.releaseAllMatured(Instant.now().plus(Duration.ofHours(25)));
        assertEquals(8500, courierWalletService.find(courierId).orElseThrow().getAvailable());

        settle(payoutService.requestPayout(courierId, payout("5000")));

        Map<CourierEarningStatus, List<CourierEarningEntity>> byStatus = earningsService.recentEarnings(courierId)
                .stream()
                .collect(Collectors.groupingBy(CourierEarningEntity::getStatus));
        assertEquals(1, byStatus.get(CourierEarningStatus.PAID_OUT).size());
        CourierEarningEntity drawnOn = byStatus.get(CourierEarningStatus.AVAILABLE).get(0);
        assertEquals(750, drawnOn.getPaidOutAmount());

        CourierWalletEntity wallet = courierWalletService.find(courierId).orElseThrow();
        assertEquals(3500, wallet.getAvailable());
        assertEquals(wallet.getAvailable(), drawnOn.getRemaining());
    }

    @Test
    void failedTransferRestoresAvailable() {
        PayoutResponse response = payoutService.requestPayout(courierId, payout("2000"));

        transactionTemplate.executeWithoutResult(status ->
                payoutService.failPayout(response.getReference(), "Account closed"));

        CourierWalletEntity wallet = courierWalletService.find(courierId).orElseThrow();
        assertEquals(4250, wallet.getAvailable());
        assertEquals(4250, wallet.getBalance());
    }

    private void settle(PayoutResponse response) {
        transactionTemplate.executeWithoutResult(status ->
                payoutService.completePayout(response.getReference(), "flw-" + response.getReference()));
    }

    private CourierEarningEntity onlyEarning() {
        List<CourierEarningEntity> earnings = earningsService.recentEarnings(courierId);
        assertEquals(1, earnings.size());
        return earnings.get(0);
    }

    private static CreatePayoutRequest payout(String amount) {
        return new CreatePayoutRequest(new BigDecimal(amount), "XOF", "mobile_money", "+22997000000",
                "mtn_momo_xof", null, "Test Courier");
    }
}
