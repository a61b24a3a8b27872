package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.audit.AuditAction;
import com.flagship.medexchange_ledger.audit.AuditService;
import com.flagship.medexchange_ledger.error.AlreadyExistsException;
import com.flagship.medexchange_ledger.error.FailedPreconditionException;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.error.PermissionDeniedException;
import com.flagship.medexchange_ledger.ledger.LedgerEntry;
import com.flagship.medexchange_ledger.ledger.LedgerEntryType;
import com.flagship.medexchange_ledger.ledger.LedgerReference;
import com.flagship.medexchange_ledger.ledger.LedgerService;
import com.flagship.medexchange_ledger.ledger.PostingRequest;
import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The delivery fee gate. Each party pays its own half from its wallet; the
 * delivery opens to couriers once both halves are in. Administrators refund
 * paid halves until the fee has been released to the courier.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryPaymentService {

    private final DeliveryRepository repository;
    private final LedgerService ledgerService;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Debits the caller's half of the fee.
     *
     * @throws PermissionDeniedException if the caller is not a paying party
     * @throws AlreadyExistsException if the caller's half is already paid
     */
    @Transactional
    public DeliveryEntity pay(UUID deliveryId) {
        CallerIdentity caller = CallerContext.require();
        DeliveryEntity delivery = lock(deliveryId);

        if (!delivery.isPartyTo(caller.getUserId())) {
            throw new PermissionDeniedException(caller.getUserId() + " is not a paying party of delivery " + deliveryId);
        }
        PartyPayment payment = delivery.paymentOf(caller.getUserId());
        if (payment.isPaid()) {
            throw new AlreadyExistsException("Delivery fee already paid by " + caller.getUserId());
        }
        if (payment.getStatus() == PartyPaymentStatus.REFUNDED || delivery.getStatus() != DeliveryStatus.PENDING) {
            throw new FailedPreconditionException(
                    "Delivery " + deliveryId + " is " + delivery.getStatus() + " and no longer takes payments");
        }

        LedgerEntry entry = ledgerService.debit(PostingRequest.builder()
                .userId(caller.getUserId())
                .amount(delivery.getFeePerParty())
                .currency(delivery.getCurrency())
                .type(LedgerEntryType.DELIVERY_PAYMENT)
                .description("Delivery fee for delivery " + deliveryId)
                .reference(LedgerReference.of(LedgerReference.DELIVERY, deliveryId))
                .meta("exchangeId", delivery.getExchangeId().toString())
                .build());
        delivery.recordPayment(caller.getUserId(), entry.getId(), clock.instant());
        repository.flush();

        auditService.recordAs(caller.getUserId(), AuditAction.DELIVERY_PAID, DeliveryService.AGGREGATE_TYPE, deliveryId, Map.of(
                "amount", delivery.getFeePerParty(),
                "currency", delivery.getCurrency().name(),
                "ledgerEntryId", entry.getId(),
                "paymentStatus", delivery.getPaymentStatus().name()));
        log.info("{} paid {} for delivery {}, payment status {}",
                caller.getUserId(), delivery.getFeePerParty(), deliveryId, delivery.getPaymentStatus());
        return delivery;
    }

    /**
     * Credits back every paid half and, when nothing has been picked up yet,
     * cancels the delivery.
     */
    @Transactional
    public DeliveryEntity refund(UUID deliveryId, String reason) {
        CallerIdentity admin = CallerContext.requireAdmin();
        if (reason == null || reason.isBlank()) {
            throw new InvalidArgumentException("A refund reason is required");
        }
        DeliveryEntity delivery = lock(deliveryId);

        if (delivery.getPaymentStatus() == DeliveryPaymentStatus.RELEASED_TO_COURIER) {
            throw new FailedPreconditionException("Delivery " + deliveryId + " was already released to the courier");
        }
        if (delivery.getStatus() == DeliveryStatus.PICKED_UP || delivery.getStatus() == DeliveryStatus.IN_TRANSIT) {
            throw new FailedPreconditionException("Delivery " + deliveryId + " is under way");
        }

        List<String> refunded = new ArrayList<>();
        for (String partyId : List.of(delivery.getFromPartyId(), delivery.getToPartyId())) {
            if (!delivery.paymentOf(partyId).isPaid()) {
                continue;
            }
            ledgerService.credit(PostingRequest.builder()
                    .userId(partyId)
                    .amount(delivery.getFeePerParty())
                    .currency(delivery.getCurrency())
                    .type(LedgerEntryType.REFUND)
                    .description("Delivery fee refund for delivery " + deliveryId)
                    .reference(LedgerReference.of(LedgerReference.DELIVERY, deliveryId))
                    .meta("reason", reason)
                    .meta("originalEntryId", delivery.paymentOf(partyId).getLedgerEntryId().toString())
                    .build());
            delivery.refundPayment(partyId);
            refunded.add(partyId);
        }
        if (refunded.isEmpty()) {
            throw new FailedPreconditionException("Delivery " + deliveryId + " has no paid fee to refund");
        }

        if (delivery.getStatus() == DeliveryStatus.PENDING || delivery.getStatus() == DeliveryStatus.ASSIGNED) {
            delivery.cancel(admin.getUserId(), reason);
        }
        repository.flush();

        auditService.recordAs(admin.getUserId(), AuditAction.DELIVERY_REFUNDED, DeliveryService.AGGREGATE_TYPE, deliveryId, Map.of(
                "reason", reason,
                "refundedParties", refunded,
                "amountPerParty", delivery.getFeePerParty(),
                "currency", delivery.getCurrency().name()));
        log.warn("Delivery {} refunded to {} by {}: {}", deliveryId, refunded, admin.getUserId(), reason);
        return delivery;
    }

    private DeliveryEntity lock(UUID deliveryId) {
        return repository.findByIdForUpdate(deliveryId)
                .orElseThrow(() -> new NotFoundException("Delivery not found: " + deliveryId));
    }
}
