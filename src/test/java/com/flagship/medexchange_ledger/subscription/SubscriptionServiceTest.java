package com.flagship.medexchange_ledger.subscription;

import com.flagship.medexchange_ledger.IntegrationTestSupport;
import com.flagship.medexchange_ledger.error.AlreadyExistsException;
import com.flagship.medexchange_ledger.error.FailedPreconditionException;
import com.flagship.medexchange_ledger.error.InsufficientBalanceException;
import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.ledger.LedgerEntry;
import com.flagship.medexchange_ledger.ledger.LedgerEntryType;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.provider.ChargeResult;
import com.flagship.medexchange_ledger.subscription.dto.ActivateSubscriptionRequest;
import com.flagship.medexchange_ledger.subscription.dto.SubscriptionPaymentRequestResponse;
import com.flagship.medexchange_ledger.subscription.dto.SubscriptionResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class SubscriptionServiceTest extends IntegrationTestSupport {

    @Autowired
    private SubscriptionService subscriptionService;

    private String userId;

    @BeforeEach
    void setUp() {
        userId = uniqueId("pharmacy");
        when(providerClient.createPaymentLink(any()))
                .thenReturn(new ChargeResult("flw-link", "https://checkout.example/pay"));
    }

    @Test
    @DisplayName("Activating the same plan twice in a day charges the wallet once")
    void walletActivationChargedOncePerDay() {
        fundWallet(userId, CurrencyCode.XOF, 10000);

        SubscriptionResponse first = subscriptionService.activate(userId, wallet("basic_monthly"));
        SubscriptionResponse second = subscriptionService.activate(userId, wallet("basic_monthly"));

        assertEquals("basic_monthly", first.getPlanId());
        assertEquals("ACTIVE", first.getStatus());
        assertEquals("BASIC", second.getTier());
        assertEquals(7500L, balanceOf(userId));

        List<LedgerEntry> debits = ledgerService.entriesForUser(userId, 10).stream()
                .filter(e -> e.getType() == LedgerEntryType.SUBSCRIPTION_PAYMENT)
                .toList();
        assertEquals(1, debits.size());
        assertEquals(2500L, debits.get(0).getAmount());
    }

    @Test
    void walletActivationNeedsFunds() {
        fundWallet(userId, CurrencyCode.XOF, 1000);

        assertThrows(InsufficientBalanceException.class,
                () -> subscriptionService.activate(userId, wallet("premium_monthly")));
        assertEquals(1000L, balanceOf(userId));
        assertTrue(subscriptionService.currentSubscription(userId).isEmpty());
    }

    @Test
    void walletInOtherCurrencyRejected() {
        fundWallet(userId, CurrencyCode.NGN, 1_000_000);

        assertThrows(FailedPreconditionException.class,
                () -> subscriptionService.activate(userId, wallet("basic_monthly")));
    }

    @Test
    void freePlanNeedsNoPayment() {
        SubscriptionResponse response = subscriptionService.activate(userId,
                new ActivateSubscriptionRequest("free", null, null));

        assertEquals("FREE", response.getTier());
    }

    @Test
    void unknownPlanNotFound() {
        assertThrows(NotFoundException.class, () -> subscriptionService.activate(userId, wallet("platinum")));
    }

    @Test
    @DisplayName("An external payment activates only the plan it paid for")
    void externalPaymentBoundToItsPlan() {
        SubscriptionPaymentRequestResponse request = subscriptionService.requestExternalPayment(userId, "basic_monthly");
        assertEquals("PENDING", request.getStatus());
        assertThrows(AlreadyExistsException.class,
                () -> subscriptionService.requestExternalPayment(userId, "basic_monthly"));

        transactionTemplate.executeWithoutResult(status -> subscriptionService.completePaymentRequest(
                request.getTxRef(), "flw-tx-1", 2500, CurrencyCode.XOF));

        assertThrows(FailedPreconditionException.class, () -> subscriptionService.activate(userId,
                new ActivateSubscriptionRequest("premium_monthly", "external", request.getTxRef())));

        SubscriptionResponse activated = subscriptionService.activate(userId,
                new ActivateSubscriptionRequest("basic_monthly", "external", request.getTxRef()));
        assertEquals("basic_monthly", activated.getPlanId());
        assertEquals("external", activated.getPaymentMethod());
    }

    @Test
    @DisplayName("A paid request activates its plan once; a retry returns the same subscription")
    void externalPaymentConsumedOnActivation() {
        String txRef = paidRequest("basic_monthly", "flw-tx-9");

        SubscriptionResponse activated = subscriptionService.activate(userId, external("basic_monthly", txRef));
        SubscriptionResponse retried = subscriptionService.activate(userId, external("basic_monthly", "flw-tx-9"));

        assertEquals("basic_monthly", retried.getPlanId());
        assertEquals(activated.getExpiresAt().truncatedTo(ChronoUnit.MILLIS),
                retried.getExpiresAt().truncatedTo(ChronoUnit.MILLIS));
    }

    @Test
    @DisplayName("A payment cannot re-activate its plan after the user switched away")
    void consumedPaymentCannotBeReused() {
        String txRef = paidRequest("basic_monthly", "flw-tx-9");
        subscriptionService.activate(userId, external("basic_monthly", txRef));
        subscriptionService.activate(userId, new ActivateSubscriptionRequest("free", null, null));

        assertThrows(FailedPreconditionException.class,
                () -> subscriptionService.activate(userId, external("basic_monthly", "flw-tx-9")));
        assertThrows(FailedPreconditionException.class,
                () -> subscriptionService.activate(userId, external("basic_monthly", txRef)));
        assertEquals("free", subscriptionService.currentSubscription(userId).orElseThrow().getPlanId());
    }

    @Test
    @DisplayName("A same-day retry of a plan the user has since replaced is refused")
    void walletRetryAfterSwitchingPlansRefused() {
        fundWallet(userId, CurrencyCode.XOF, 10000);
        subscriptionService.activate(userId, wallet("basic_monthly"));
        subscriptionService.activate(userId, wallet("premium_monthly"));

        assertThrows(FailedPreconditionException.class,
                () -> subscriptionService.activate(userId, wallet("basic_monthly")));
        assertEquals("premium_monthly", subscriptionService.currentSubscription(userId).orElseThrow().getPlanId());
        assertEquals(2500L, balanceOf(userId));
    }

    @Test
    void externalPaymentMustBeCompleted() {
        SubscriptionPaymentRequestResponse request = subscriptionService.requestExternalPayment(userId, "basic_monthly");

        assertThrows(NotFoundException.class, () -> subscriptionService.activate(userId,
                new ActivateSubscriptionRequest("basic_monthly", "external", request.getTxRef())));
    }

    private String paidRequest(String planId, String providerTxId) {
        SubscriptionPaymentRequestResponse request = subscriptionService.requestExternalPayment(userId, planId);
        transactionTemplate.executeWithoutResult(status -> subscriptionService.completePaymentRequest(
                request.getTxRef(), providerTxId, 2500, CurrencyCode.XOF));
        return request.getTxRef();
    }

    private static ActivateSubscriptionRequest external(String planId, String reference) {
        return new ActivateSubscriptionRequest(planId, "external", reference);
    }

    private static ActivateSubscriptionRequest wallet(String planId) {
        return new ActivateSubscriptionRequest(planId, "wallet", null);
    }
}
