package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.audit.AuditAction;
import com.flagship.medexchange_ledger.audit.AuditService;
import com.flagship.medexchange_ledger.error.FailedPreconditionException;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.error.PermissionDeniedException;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.observability.CorrelationContext;
import com.flagship.medexchange_ledger.observability.LedgerMetrics;
import com.flagship.medexchange_ledger.outbox.OutboxService;
import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import com.flagship.medexchange_ledger.workflow.event.DeliveryCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiConsumer;

/**
 * Delivery lifecycle: creation from an accepted exchange, courier acceptance
 * behind the payment gate, and the courier's progress through pick-up,
 * transit and hand-over, which also carries the exchange along.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryService {

    static final String AGGREGATE_TYPE = "delivery";
    private static final String CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private final DeliveryRepository repository;
    private final ExchangeService exchangeService;
    private final CourierServiceArea serviceArea;
    private final CourierProfileRepository courierProfileRepository;
    private final DeliveryFeeProperties feeProperties;
    private final AuditService auditService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    /**
     * Creates the delivery of an accepted exchange. Repeat calls return the
     * existing delivery.
     */
    @Transactional
    public DeliveryEntity createForAcceptedExchange(UUID exchangeId) {
        Optional<DeliveryEntity> existing = repository.findByExchangeId(exchangeId);
        if (existing.isPresent()) {
            log.info("Delivery for exchange {} already exists, skipping", exchangeId);
            return existing.get();
        }

        ExchangeEntity exchange = exchangeService.get(exchangeId);
        if (exchange.getResponderId() == null || exchange.getStatus() == ExchangeStatus.DRAFT
                || exchange.getStatus() == ExchangeStatus.PENDING || exchange.getStatus() == ExchangeStatus.REJECTED) {
            throw new FailedPreconditionException("Exchange " + exchangeId + " has not been accepted");
        }

        DeliveryFeeProperties.Fee fee = feeProperties.feeFor(exchange.getLocation().getCountryCode());
        long feeAmount = MoneyNormalizer.toSmallestUnit(fee.getAmount(), fee.getCurrency());
        DeliveryEntity delivery = repository.saveAndFlush(DeliveryEntity.forExchange(
                exchange, feeAmount, fee.getCurrency(), nextCode(), nextCode()));

        auditService.record(AuditAction.DELIVERY_CREATED, AGGREGATE_TYPE, delivery.getId(), Map.of(
                "exchangeId", exchangeId,
                "fromPartyId", delivery.getFromPartyId(),
                "toPartyId", delivery.getToPartyId(),
                "fee", feeAmount,
                "currency", fee.getCurrency().name()));
        log.info("Delivery {} created for exchange {}: fee {} ({} per party)",
                delivery.getId(), exchangeId,
                MoneyNormalizer.formatForDisplay(feeAmount, fee.getCurrency()),
                MoneyNormalizer.formatForDisplay(delivery.getFeePerParty(), fee.getCurrency()));
        return delivery;
    }

    /**
     * A courier takes a fully paid delivery in one of its service cities.
     */
    @Transactional
    public DeliveryEntity accept(UUID deliveryId) {
        CallerIdentity courier = CallerContext.requireCourier();
        return transition(deliveryId, DeliveryStatus.ASSIGNED, (delivery, caller) -> {
            if (!delivery.isPaymentComplete()) {
                throw new FailedPreconditionException(
                        "Delivery " + deliveryId + " is " + delivery.getPaymentStatus() + ", not fully paid");
            }
            if (!serviceArea.serves(courier.getUserId(), delivery.getLocation().getCityId())) {
                throw new PermissionDeniedException(
                        "Courier " + courier.getUserId() + " does not serve " + delivery.getLocation().getCityId());
            }
            delivery.assign(courier.getUserId(), clock.instant());
            exchangeService.assignCourier(delivery.getExchangeId(), courier.getUserId());
        });
    }

    @Transactional
    public DeliveryEntity pickUp(UUID deliveryId, String pickupCode) {
        return transition(deliveryId, DeliveryStatus.PICKED_UP, (delivery, caller) -> {
            requireCode(delivery.getPickupCode(), pickupCode, "Pickup");
            delivery.markPickedUp(clock.instant());
        });
    }

    @Transactional
    public DeliveryEntity startTransit(UUID deliveryId) {
        return transition(deliveryId, DeliveryStatus.IN_TRANSIT, (delivery, caller) -> {
            delivery.markInTransit();
            exchangeService.markInTransit(delivery.getExchangeId());
        });
    }

    /**
     * Hand-over to the receiving party. Completes the exchange, releases the
     * fee to the courier and publishes DeliveryCompleted for the earning.
     */
    @Transactional
    public DeliveryEntity deliver(UUID deliveryId, String deliveryCode) {
        DeliveryEntity delivered = transition(deliveryId, DeliveryStatus.DELIVERED, (delivery, caller) -> {
            requireCode(delivery.getDeliveryCode(), deliveryCode, "Delivery");
            delivery.markDelivered(clock.instant());
            exchangeService.complete(delivery.getExchangeId());
        });

        outboxService.saveEvent(AGGREGATE_TYPE, delivered.getId(), DeliveryCompletedEvent.EVENT_TYPE,
                DeliveryCompletedEvent.of(delivered.getId(), delivered.getExchangeId(), delivered.getCourierId(),
                        delivered.getFee(), delivered.getCurrency().name(), delivered.getCompletedAt()));
        return delivered;
    }

    @Transactional
    public DeliveryEntity fail(UUID deliveryId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new InvalidArgumentException("A failure reason is required");
        }
        return transition(deliveryId, DeliveryStatus.FAILED,
                (delivery, caller) -> delivery.markFailed(reason, clock.instant()));
    }

    /**
     * Either paying party withdraws before pick-up. Paid fees stay paid until
     * an administrator refunds them.
     */
    @Transactional
    public DeliveryEntity cancel(UUID deliveryId, String reason) {
        return transition(deliveryId, DeliveryStatus.CANCELLED,
                (delivery, caller) -> delivery.cancel(caller.getUserId(), reason));
    }

    /**
     * Parties, the assigned courier and administrators see a delivery. Other
     * couriers see it only while it is open to them: paid, unassigned and in
     * a city they serve.
     */
    @Transactional(readOnly = true)
    public DeliveryEntity getVisible(UUID deliveryId) {
        CallerIdentity caller = CallerContext.require();
        DeliveryEntity delivery = repository.findById(deliveryId)
                .orElseThrow(() -> new NotFoundException("Delivery not found: " + deliveryId));
        boolean visible = caller.isAdmin()
                || delivery.isPartyTo(caller.getUserId())
                || caller.is(delivery.getCourierId())
                || (caller.isCourier()
                        && delivery.getStatus() == DeliveryStatus.PENDING
                        && delivery.isPaymentComplete()
                        && serviceArea.serves(caller.getUserId(), delivery.getLocation().getCityId()));
        if (!visible) {
            throw new PermissionDeniedException("Delivery " + deliveryId + " is not visible to " + caller.getUserId());
        }
        return delivery;
    }

    @Transactional(readOnly = true)
    public List<DeliveryEntity> acceptableForCaller() {
        CallerIdentity courier = CallerContext.requireCourier();
        return courierProfileRepository.findById(courier.getUserId())
                .filter(CourierProfileEntity::isActive)
                .map(profile -> repository.findAcceptableInCities(profile.getServiceCities()))
                .orElse(List.of());
    }

    private DeliveryEntity transition(UUID deliveryId, DeliveryStatus target,
                                      BiConsumer<DeliveryEntity, CallerIdentity> change) {
        CallerIdentity caller = CallerContext.require();
        MDC.put(CorrelationContext.DELIVERY_ID_MDC_KEY, deliveryId.toString());
        try {
            DeliveryEntity delivery = lock(deliveryId);
            DeliveryState state = delivery.currentState();

            if (!WorkflowRules.DELIVERY.allows(state.status(), target)) {
                throw new FailedPreconditionException(String.format(
                        "Delivery %s cannot move from %s to %s", deliveryId, state.status(), target));
            }
            if (!WorkflowRules.DELIVERY.permits(state.status(), target, WorkflowRules.relationsTo(caller, state))) {
                throw new PermissionDeniedException(String.format(
                        "%s may not move delivery %s from %s to %s",
                        caller.getUserId(), deliveryId, state.status(), target));
            }

            change.accept(delivery, caller);
            repository.flush();

            auditService.recordAs(caller.getUserId(), AuditAction.DELIVERY_TRANSITIONED, AGGREGATE_TYPE, deliveryId,
                    Map.of("from", state.status().name(), "to", target.name()));
            metrics.recordTransition(AGGREGATE_TYPE, target.name());
            log.info("Delivery {} moved {} -> {} by {}", deliveryId, state.status(), target, caller.getUserId());
            return delivery;
        } finally {
            MDC.remove(CorrelationContext.DELIVERY_ID_MDC_KEY);
        }
    }

    DeliveryEntity lock(UUID deliveryId) {
        return repository.findByIdForUpdate(deliveryId)
                .orElseThrow(() -> new NotFoundException("Delivery not found: " + deliveryId));
    }

    private static void requireCode(String expected, String given, String kind) {
        if (given == null || !expected.equalsIgnoreCase(given.trim())) {
            throw new InvalidArgumentException(kind + " code does not match");
        }
    }

    private String nextCode() {
        StringBuilder code = new StringBuilder(feeProperties.getCodeLength());
        for (int i = 0; i < feeProperties.getCodeLength(); i++) {
            code.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return code.toString();
    }
}
