package com.flagship.medexchange_ledger.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.medexchange_ledger.IntegrationTestSupport;
import com.flagship.medexchange_ledger.audit.AuditAction;
import com.flagship.medexchange_ledger.audit.AuditLogEntity;
import com.flagship.medexchange_ledger.audit.AuditLogRepository;
import com.flagship.medexchange_ledger.consumer.WorkflowEventHandler;
import com.flagship.medexchange_ledger.earnings.CourierWalletEntity;
import com.flagship.medexchange_ledger.earnings.CourierWalletService;
import com.flagship.medexchange_ledger.error.AlreadyExistsException;
import com.flagship.medexchange_ledger.error.FailedPreconditionException;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.error.PermissionDeniedException;
import com.flagship.medexchange_ledger.error.PolicyViolationException;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import com.flagship.medexchange_ledger.workflow.dto.CreateExchangeRequest;
import com.flagship.medexchange_ledger.workflow.dto.ExchangeItemRequest;
import com.flagship.medexchange_ledger.workflow.dto.ExchangeOverrideRequest;
import com.flagship.medexchange_ledger.workflow.dto.RegisterCourierRequest;
import com.flagship.medexchange_ledger.workflow.event.DeliveryCompletedEvent;
import com.flagship.medexchange_ledger.workflow.event.ExchangeAcceptedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exchange and delivery lifecycle in Douala, where a delivery costs 500 XAF
 * split between the two pharmacies.
 */
class ExchangeDeliveryWorkflowTest extends IntegrationTestSupport {

    private static final String CITY = "cm_douala";
    private static final String GROUP = "workflow-test";

    @Autowired
    private ExchangeService exchangeService;

    @Autowired
    private DeliveryService deliveryService;

    @Autowired
    private DeliveryPaymentService deliveryPaymentService;

    @Autowired
    private CourierProfileService courierProfileService;

    @Autowired
    private WorkflowEventHandler eventHandler;

    @Autowired
    private ExchangeRepository exchangeRepository;

    @Autowired
    private DeliveryRepository deliveryRepository;

    @Autowired
    private CourierWalletService courierWalletService;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private ObjectMapper objectMapper;

    private CallerIdentity requester;
    private CallerIdentity responder;
    private CallerIdentity courier;

    @BeforeEach
    void setUp() {
        requester = party(uniqueId("pharmacy-a"), CITY);
        responder = party(uniqueId("pharmacy-b"), CITY);
        courier = courier(uniqueId("courier"));
        fundWallet(requester.getUserId(), CurrencyCode.XAF, 1000);
        fundWallet(responder.getUserId(), CurrencyCode.XAF, 1000);
        as(admin(), () -> courierProfileService.register(courier.getUserId(),
                new RegisterCourierRequest("CM", Set.of(CITY), true)));
    }

    @Test
    @DisplayName("Accepted exchange is delivered, paid for by both parties and earned by the courier")
    void fullLifecycle() {
        ExchangeEntity exchange = openExchange(true);
        DeliveryEntity delivery = acceptAndCreateDelivery(exchange);

        assertEquals(500, delivery.getFee());
        assertEquals(250, delivery.getFeePerParty());
        assertEquals(requester.getUserId(), delivery.getFromPartyId());
        assertEquals(responder.getUserId(), delivery.getToPartyId());

        UUID deliveryId = delivery.getId();
        assertThrows(FailedPreconditionException.class, () -> as(courier, () -> deliveryService.accept(deliveryId)),
                "couriers cannot take an unpaid delivery");

        DeliveryEntity halfPaid = as(requester, () -> deliveryPaymentService.pay(deliveryId));
        assertEquals(DeliveryPaymentStatus.PARTIAL_PAYMENT, halfPaid.getPaymentStatus());
        assertThrows(AlreadyExistsException.class, () -> as(requester, () -> deliveryPaymentService.pay(deliveryId)));
        DeliveryEntity paid = as(responder, () -> deliveryPaymentService.pay(deliveryId));
        assertEquals(DeliveryPaymentStatus.PAYMENT_COMPLETE, paid.getPaymentStatus());
        assertEquals(750L, balanceOf(requester.getUserId()));
        assertEquals(750L, balanceOf(responder.getUserId()));

        assertTrue(as(courier, () -> deliveryService.acceptableForCaller()).stream()
                .anyMatch(d -> d.getId().equals(deliveryId)));

        DeliveryEntity assigned = as(courier, () -> deliveryService.accept(deliveryId));
        assertEquals(DeliveryStatus.ASSIGNED, assigned.getStatus());
        assertEquals(courier.getUserId(), exchangeService.get(exchange.getId()).getCourierId());

        assertThrows(FailedPreconditionException.class,
                () -> as(courier, () -> deliveryService.deliver(deliveryId, assigned.getDeliveryCode())),
                "an assigned delivery has not been picked up");
        assertThrows(InvalidArgumentException.class,
                () -> as(courier, () -> deliveryService.pickUp(deliveryId, "WRONG1")));

        as(courier, () -> deliveryService.pickUp(deliveryId, assigned.getPickupCode()));
        as(courier, () -> deliveryService.startTransit(deliveryId));
        assertEquals(ExchangeStatus.IN_TRANSIT, exchangeService.get(exchange.getId()).getStatus());

        DeliveryEntity delivered = as(courier, () -> deliveryService.deliver(deliveryId, assigned.getDeliveryCode()));
        assertEquals(DeliveryStatus.DELIVERED, delivered.getStatus());
        assertEquals(DeliveryPaymentStatus.RELEASED_TO_COURIER, delivered.getPaymentStatus());
        assertEquals(ExchangeStatus.COMPLETED, exchangeService.get(exchange.getId()).getStatus());
        assertEquals(1, countOutbox(deliveryId, DeliveryCompletedEvent.EVENT_TYPE));

        DeliveryCompletedEvent completed = DeliveryCompletedEvent.of(deliveryId, exchange.getId(),
                courier.getUserId(), delivered.getFee(), "XAF", delivered.getCompletedAt());
        assertTrue(eventHandler.onDeliveryCompleted(completed, GROUP));
        assertFalse(eventHandler.onDeliveryCompleted(completed, GROUP), "redelivered event has no effect");

        CourierWalletEntity wallet = courierWalletService.find(courier.getUserId()).orElseThrow();
        assertEquals(425, wallet.getPending());
        assertEquals(CurrencyCode.XAF, wallet.getCurrency());
    }

    @Test
    void courierOutsideServiceAreaCannotAccept() {
        DeliveryEntity delivery = acceptAndCreateDelivery(openExchange(true));
        payBoth(delivery.getId());

        CallerIdentity stranger = courier(uniqueId("courier"));
        assertThrows(PermissionDeniedException.class, () -> as(stranger, () -> deliveryService.accept(delivery.getId())));
        assertThrows(PermissionDeniedException.class, () -> as(stranger, () -> deliveryService.getVisible(delivery.getId())));

        CallerIdentity elsewhere = courier(uniqueId("courier"));
        as(admin(), () -> courierProfileService.register(elsewhere.getUserId(),
                new RegisterCourierRequest("CM", Set.of("cm_yaounde"), true)));
        assertThrows(PermissionDeniedException.class, () -> as(elsewhere, () -> deliveryService.accept(delivery.getId())));
    }

    @Test
    void exchangeTransitionsFollowTheTable() {
        ExchangeEntity draft = openExchange(false);
        UUID id = draft.getId();

        assertThrows(FailedPreconditionException.class, () -> as(responder, () -> exchangeService.accept(id)),
                "a draft is not open for answers");
        assertThrows(PermissionDeniedException.class, () -> as(responder, () -> exchangeService.submit(id)));

        as(requester, () -> exchangeService.submit(id));
        assertThrows(PermissionDeniedException.class, () -> as(requester, () -> exchangeService.accept(id)),
                "a requester cannot answer its own exchange");

        as(responder, () -> exchangeService.reject(id));
        ExchangeEntity reopened = as(requester, () -> exchangeService.reopen(id));
        assertEquals(ExchangeStatus.PENDING, reopened.getStatus());
    }

    @Test
    @DisplayName("Writes that bypass the services are rejected at flush")
    void storageRejectsBypassingWrites() {
        ExchangeEntity draft = openExchange(false);

        RuntimeException skipped = assertThrows(RuntimeException.class, () -> as(requester, () ->
                transactionTemplate.execute(status -> {
                    ExchangeEntity loaded = exchangeRepository.findById(draft.getId()).orElseThrow();
                    loaded.moveTo(ExchangeStatus.ACCEPTED);
                    return exchangeRepository.saveAndFlush(loaded);
                })));
        assertTrue(causedByPolicy(skipped));
        assertEquals(ExchangeStatus.DRAFT, exchangeService.get(draft.getId()).getStatus());

        DeliveryEntity delivery = acceptAndCreateDelivery(openExchange(true));
        RuntimeException counterparty = assertThrows(RuntimeException.class, () -> as(requester, () ->
                transactionTemplate.execute(status -> {
                    DeliveryEntity loaded = deliveryRepository.findById(delivery.getId()).orElseThrow();
                    loaded.recordPayment(responder.getUserId(), UUID.randomUUID(), Instant.now());
                    return deliveryRepository.saveAndFlush(loaded);
                })));
        assertTrue(causedByPolicy(counterparty), "a party may not mark the other half paid");
    }

    @Test
    @DisplayName("Requester and location cannot be rewritten outside the override, even by an administrator")
    void requesterAndLocationImmutableOutsideOverride() {
        ExchangeEntity exchange = openExchange(true);
        String intruder = uniqueId("pharmacy-c");

        for (CallerIdentity caller : List.of(requester, admin())) {
            RuntimeException denied = assertThrows(RuntimeException.class, () -> as(caller, () ->
                    transactionTemplate.execute(status -> {
                        ExchangeEntity loaded = exchangeRepository.findById(exchange.getId()).orElseThrow();
                        ReflectionTestUtils.setField(loaded, "requesterId", intruder);
                        return exchangeRepository.saveAndFlush(loaded);
                    })));
            assertTrue(causedByPolicy(denied), caller.getUserId() + " rewrote the requester");
        }

        RuntimeException moved = assertThrows(RuntimeException.class, () -> as(admin(), () ->
                transactionTemplate.execute(status -> {
                    ExchangeEntity loaded = exchangeRepository.findById(exchange.getId()).orElseThrow();
                    ReflectionTestUtils.setField(loaded, "location", Location.of("cm_yaounde", "CM"));
                    return exchangeRepository.saveAndFlush(loaded);
                })));
        assertTrue(causedByPolicy(moved));

        ExchangeEntity unchanged = exchangeService.get(exchange.getId());
        assertEquals(requester.getUserId(), unchanged.getRequesterId());
        assertEquals(CITY, unchanged.getLocation().getCityId());
    }

    @Test
    @DisplayName("An administrative override needs a justification and is audited with before and after values")
    void overrideRequiresJustificationAndIsAudited() throws Exception {
        ExchangeEntity exchange = openExchange(true);
        String newRequester = uniqueId("pharmacy-c");

        assertThrows(InvalidArgumentException.class, () -> as(admin(), () -> exchangeService.override(
                exchange.getId(), new ExchangeOverrideRequest(newRequester, null, null, "  "))));
        assertThrows(PermissionDeniedException.class, () -> as(requester, () -> exchangeService.override(
                exchange.getId(), new ExchangeOverrideRequest(newRequester, null, null, "Pharmacy merged"))));
        assertTrue(auditLogRepository.findByResourceTypeAndResourceIdOrderByCreatedAtAsc(
                "exchange", exchange.getId().toString()).stream()
                .noneMatch(entry -> entry.getAction() == AuditAction.ADMIN_OVERRIDE));

        ExchangeEntity overridden = as(admin(), () -> exchangeService.override(exchange.getId(),
                new ExchangeOverrideRequest(newRequester, "cm_yaounde", "CM", "Pharmacy merged")));

        assertEquals(newRequester, overridden.getRequesterId());
        assertEquals("cm_yaounde", exchangeService.get(exchange.getId()).getLocation().getCityId());

        List<AuditLogEntity> overrides = auditLogRepository.findByResourceTypeAndResourceIdOrderByCreatedAtAsc(
                "exchange", exchange.getId().toString()).stream()
                .filter(entry -> entry.getAction() == AuditAction.ADMIN_OVERRIDE)
                .toList();
        assertEquals(1, overrides.size());
        assertEquals(admin().getUserId(), overrides.get(0).getActorId());

        JsonNode details = objectMapper.readTree(overrides.get(0).getDetails());
        assertEquals("Pharmacy merged", details.path("justification").asText());
        assertEquals(requester.getUserId(), details.path("before").path("requesterId").asText());
        assertEquals(CITY, details.path("before").path("cityId").asText());
        assertEquals(newRequester, details.path("after").path("requesterId").asText());
        assertEquals("cm_yaounde", details.path("after").path("cityId").asText());
    }

    @Test
    void deliveryCreationIsIdempotent() {
        ExchangeEntity exchange = openExchange(true);
        as(responder, () -> exchangeService.accept(exchange.getId()));
        assertEquals(1, countOutbox(exchange.getId(), ExchangeAcceptedEvent.EVENT_TYPE));

        ExchangeAcceptedEvent event = acceptedEvent(exchange);
        assertTrue(eventHandler.onExchangeAccepted(event, GROUP));
        assertFalse(eventHandler.onExchangeAccepted(event, GROUP));

        DeliveryEntity first = deliveryRepository.findByExchangeId(exchange.getId()).orElseThrow();
        assertEquals(first.getId(), deliveryService.createForAcceptedExchange(exchange.getId()).getId());
    }

    @Test
    @DisplayName("Refunding a paid delivery credits both parties and cancels it")
    void refundBeforePickup() {
        DeliveryEntity delivery = acceptAndCreateDelivery(openExchange(true));
        payBoth(delivery.getId());

        assertThrows(PermissionDeniedException.class,
                () -> as(requester, () -> deliveryPaymentService.refund(delivery.getId(), "changed my mind")));

        DeliveryEntity refunded = as(admin(), () -> deliveryPaymentService.refund(delivery.getId(), "Courier unavailable"));

        assertEquals(DeliveryStatus.CANCELLED, refunded.getStatus());
        assertEquals(DeliveryPaymentStatus.REFUNDED, refunded.getPaymentStatus());
        assertEquals(1000L, balanceOf(requester.getUserId()));
        assertEquals(1000L, balanceOf(responder.getUserId()));
        assertThrows(FailedPreconditionException.class,
                () -> as(admin(), () -> deliveryPaymentService.refund(delivery.getId(), "again")));
    }

    @Test
    void unpaidDeliveryHiddenFromCouriers() {
        DeliveryEntity delivery = acceptAndCreateDelivery(openExchange(true));

        assertEquals(6, delivery.getPickupCode().length());
        assertNotEquals(delivery.getPickupCode(), delivery.getDeliveryCode());
        assertThrows(PermissionDeniedException.class,
                () -> as(courier, () -> deliveryService.getVisible(delivery.getId())),
                "an unpaid delivery is not open to couriers");
    }

    private ExchangeEntity openExchange(boolean submit) {
        return as(requester, () -> exchangeService.create(new CreateExchangeRequest(CITY, "CM", null,
                List.of(new ExchangeItemRequest("amoxicillin-500", "Amoxicillin 500mg", 20)),
                List.of(new ExchangeItemRequest("paracetamol-1000", "Paracetamol 1g", 50)),
                submit)));
    }

    private DeliveryEntity acceptAndCreateDelivery(ExchangeEntity exchange) {
        as(responder, () -> exchangeService.accept(exchange.getId()));
        eventHandler.onExchangeAccepted(acceptedEvent(exchange), GROUP);
        return deliveryRepository.findByExchangeId(exchange.getId()).orElseThrow();
    }

    private ExchangeAcceptedEvent acceptedEvent(ExchangeEntity exchange) {
        return ExchangeAcceptedEvent.of(exchange.getId(), requester.getUserId(), responder.getUserId(),
                CITY, "CM", Instant.now());
    }

    private void payBoth(UUID deliveryId) {
        as(requester, () -> deliveryPaymentService.pay(deliveryId));
        as(responder, () -> deliveryPaymentService.pay(deliveryId));
    }

    private int countOutbox(UUID aggregateId, String eventType) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM outbox_events WHERE aggregate_id = ? AND event_type = ?",
                Integer.class, aggregateId, eventType);
        return count != null ? count : 0;
    }

    private static boolean causedByPolicy(Throwable thrown) {
        for (Throwable t = thrown; t != null; t = t.getCause()) {
            if (t instanceof PolicyViolationException) {
                return true;
            }
        }
        return false;
    }
}
