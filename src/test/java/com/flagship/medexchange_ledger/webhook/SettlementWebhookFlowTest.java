package com.flagship.medexchange_ledger.webhook;

import com.flagship.medexchange_ledger.IntegrationTestSupport;
import com.flagship.medexchange_ledger.earnings.CourierPayoutRepository;
import com.flagship.medexchange_ledger.earnings.CourierWalletEntity;
import com.flagship.medexchange_ledger.earnings.CourierWalletService;
import com.flagship.medexchange_ledger.earnings.EarningsReleaseService;
import com.flagship.medexchange_ledger.earnings.EarningsService;
import com.flagship.medexchange_ledger.earnings.PayoutService;
import com.flagship.medexchange_ledger.earnings.PayoutStatus;
import com.flagship.medexchange_ledger.earnings.dto.CreatePayoutRequest;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.provider.ChargeResult;
import com.flagship.medexchange_ledger.provider.TransferResult;
import com.flagship.medexchange_ledger.provider.VerifiedTransaction;
import com.flagship.medexchange_ledger.subscription.SubscriptionService;
import com.flagship.medexchange_ledger.subscription.dto.ActivateSubscriptionRequest;
import com.flagship.medexchange_ledger.subscription.dto.SubscriptionResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Callbacks that settle subscription payments and courier payouts. The
 * courier starts with 4,250 XOF available and a 2,000 XOF payout in flight.
 */
@AutoConfigureMockMvc
class SettlementWebhookFlowTest extends IntegrationTestSupport {

    private static final String SECRET = "test-webhook-secret";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private EarningsService earningsService;

    @Autowired
    private EarningsReleaseService releaseService;

    @Autowired
    private PayoutService payoutService;

    @Autowired
    private CourierWalletService courierWalletService;

    @Autowired
    private CourierPayoutRepository payoutRepository;

    private String courierId;
    private String payoutReference;

    @BeforeEach
    void setUp() {
        courierId = uniqueId("courier");
        earningsService.recordEarning(UUID.randomUUID(), courierId, 5000, CurrencyCode.XOF);
        releaseService.releaseAllMatured(Instant.now().plus(Duration.ofHours(25)));
        when(providerClient.initiateTransfer(any())).thenReturn(new TransferResult("flw-transfer", "NEW"));
        when(providerClient.createPaymentLink(any()))
                .thenReturn(new ChargeResult("flw-link", "https://checkout.example/pay"));

        payoutReference = payoutService.requestPayout(courierId, new CreatePayoutRequest(new BigDecimal("2000"),
                "XOF", "mobile_money", "+22997000000", "mtn_momo_xof", null, "Test Courier")).getReference();
    }

    @Test
    @DisplayName("A verified subscription charge completes the request, which then activates the plan")
    void subscriptionChargeCompletesRequest() throws Exception {
        String userId = uniqueId("pharmacy");
        String txRef = subscriptionService.requestExternalPayment(userId, "basic_monthly").getTxRef();
        String providerTxId = uniqueId("flw");
        when(providerClient.verifyTransaction(providerTxId))
                .thenReturn(new VerifiedTransaction(providerTxId, txRef, "successful", new BigDecimal("2500"), "XOF"));

        postCallback("""
                {"event":"charge.completed","data":{"id":"%s","tx_ref":"%s","amount":2500,"currency":"XOF",
                 "status":"successful","meta":{"source":"nowastedmed","type":"subscription_payment"}}}
                """.formatted(providerTxId, txRef))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSED"));

        assertEquals("COMPLETED", requestStatus(txRef));
        SubscriptionResponse activated = subscriptionService.activate(userId,
                new ActivateSubscriptionRequest("basic_monthly", "external", providerTxId));
        assertEquals("basic_monthly", activated.getPlanId());
        assertEquals("CONSUMED", requestStatus(txRef));
    }

    @Test
    void subscriptionChargeFailedClosesRequest() throws Exception {
        String txRef = subscriptionService.requestExternalPayment(uniqueId("pharmacy"), "basic_monthly").getTxRef();

        postCallback("""
                {"event":"charge.failed","data":{"id":"%s","tx_ref":"%s","amount":2500,"currency":"XOF",
                 "status":"failed","meta":{"source":"nowastedmed","type":"subscription_payment"}}}
                """.formatted(uniqueId("flw"), txRef))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSED"));

        assertEquals("FAILED", requestStatus(txRef));
    }

    @Test
    @DisplayName("transfer.completed settles the payout once; the repeat is a duplicate")
    void transferCompletedSettlesPayout() throws Exception {
        String transferId = uniqueId("flw-transfer");
        String body = transfer("transfer.completed", transferId, "SUCCESSFUL");

        postCallback(body).andExpect(status().isOk()).andExpect(jsonPath("$.status").value("PROCESSED"));
        postCallback(body).andExpect(status().isOk()).andExpect(jsonPath("$.status").value("DUPLICATE"));

        assertEquals(PayoutStatus.COMPLETED, payoutRepository.findByReference(payoutReference).orElseThrow().getStatus());
        CourierWalletEntity wallet = courierWalletService.find(courierId).orElseThrow();
        assertEquals(2250, wallet.getBalance());
        assertEquals(2250, wallet.getAvailable());
        assertEquals(2000, wallet.getTotalPaidOut());
        verify(providerClient, never()).verifyTransaction(anyString());
    }

    @Test
    @DisplayName("transfer.completed reporting a FAILED transfer gives the reservation back")
    void transferCompletedWithFailedStatusReverts() throws Exception {
        postCallback(transfer("transfer.completed", uniqueId("flw-transfer"), "FAILED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSED"));

        assertPayoutReverted();
    }

    @Test
    void transferFailedReverts() throws Exception {
        String body = transfer("transfer.failed", uniqueId("flw-transfer"), "FAILED");

        postCallback(body).andExpect(status().isOk()).andExpect(jsonPath("$.status").value("PROCESSED"));
        postCallback(body).andExpect(status().isOk()).andExpect(jsonPath("$.status").value("DUPLICATE"));

        assertPayoutReverted();
    }

    @Test
    @DisplayName("A failure callback for an already settled payout changes nothing")
    void lateFailureAfterCompletionIgnored() throws Exception {
        postCallback(transfer("transfer.completed", uniqueId("flw-transfer"), "SUCCESSFUL"))
                .andExpect(jsonPath("$.status").value("PROCESSED"));
        postCallback(transfer("transfer.failed", uniqueId("flw-transfer"), "FAILED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IGNORED"));

        assertEquals(PayoutStatus.COMPLETED, payoutRepository.findByReference(payoutReference).orElseThrow().getStatus());
        assertEquals(2250, courierWalletService.find(courierId).orElseThrow().getAvailable());
    }

    private void assertPayoutReverted() {
        assertEquals(PayoutStatus.FAILED, payoutRepository.findByReference(payoutReference).orElseThrow().getStatus());
        CourierWalletEntity wallet = courierWalletService.find(courierId).orElseThrow();
        assertEquals(4250, wallet.getAvailable());
        assertEquals(4250, wallet.getBalance());
        assertEquals(0, wallet.getTotalPaidOut());
    }

    private String requestStatus(String txRef) {
        return jdbcTemplate.queryForObject(
                "SELECT status FROM subscription_requests WHERE tx_ref = ?", String.class, txRef);
    }

    private ResultActions postCallback(String body) throws Exception {
        return mockMvc.perform(post("/api/webhooks/payment-provider")
                .header(WebhookSignatureVerifier.SIGNATURE_HEADER, SECRET)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private String transfer(String event, String transferId, String transferStatus) {
        return """
                {"event":"%s","data":{"id":"%s","reference":"%s","amount":1980,"currency":"XOF",
                 "status":"%s","complete_message":"Transfer %s","meta":{"source":"nowastedmed","type":"courier_payout"}}}
                """.formatted(event, transferId, payoutReference, transferStatus, transferStatus.toLowerCase());
    }
}
