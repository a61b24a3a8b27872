package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.error.PolicyViolationException;
import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PostUpdate;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Checks every delivery write at flush time: the transition table, the
 * payment gate on courier acceptance, the courier's service area, and that
 * each party only ever touches its own half of the fee.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryWritePolicy {

    private final CourierServiceArea serviceArea;

    @PostLoad
    @PostPersist
    @PostUpdate
    void remember(DeliveryEntity delivery) {
        delivery.rememberPersistedState();
    }

    @PrePersist
    void beforeInsert(DeliveryEntity delivery) {
        CallerIdentity caller = CallerContext.current().orElse(null);
        if (caller != null && !caller.isAdmin()) {
            throw deny("Deliveries are created by the system when an exchange is accepted");
        }
        if (delivery.getStatus() != DeliveryStatus.PENDING
                || delivery.getPaymentStatus() != DeliveryPaymentStatus.AWAITING_PAYMENT
                || delivery.getFromPayment().getStatus() != PartyPaymentStatus.PENDING
                || delivery.getToPayment().getStatus() != PartyPaymentStatus.PENDING
                || delivery.getCourierId() != null) {
            throw deny("A new delivery is PENDING, unpaid and unassigned");
        }
    }

    @PreUpdate
    void beforeUpdate(DeliveryEntity delivery) {
        DeliveryState before = delivery.getPersistedState();
        if (before == null) {
            throw deny("Delivery " + delivery.getId() + " was not loaded before being written");
        }
        DeliveryState after = delivery.currentState();
        CallerIdentity caller = CallerContext.current().orElse(null);

        if (!Objects.equals(before.exchangeId(), after.exchangeId())
                || !Objects.equals(before.fromPartyId(), after.fromPartyId())
                || !Objects.equals(before.toPartyId(), after.toPartyId())
                || !Objects.equals(before.cityId(), after.cityId())
                || before.fee() != after.fee()
                || before.feePerParty() != after.feePerParty()) {
            throw deny("Parties, city and fee of delivery " + delivery.getId() + " are fixed at creation");
        }

        checkCourier(before, after, caller);
        checkStatus(delivery, before, after, caller);
        checkPartyPayment(before, before.fromPaymentStatus(), after.fromPaymentStatus(), before.fromPartyId(), caller);
        checkPartyPayment(before, before.toPaymentStatus(), after.toPaymentStatus(), before.toPartyId(), caller);

        DeliveryPaymentStatus expected = WorkflowRules.paymentStatusFor(
                after.fromPaymentStatus(), after.toPaymentStatus(), after.status());
        if (after.paymentStatus() != expected) {
            throw deny(String.format("Payment status %s does not match the party payments (%s)",
                    after.paymentStatus(), expected));
        }
    }

    private void checkCourier(DeliveryState before, DeliveryState after, CallerIdentity caller) {
        if (Objects.equals(before.courierId(), after.courierId())) {
            return;
        }
        boolean assigning = before.courierId() == null
                && before.status() == DeliveryStatus.PENDING
                && after.status() == DeliveryStatus.ASSIGNED
                && (caller == null || caller.is(after.courierId()));
        if (!assigning) {
            throw deny("A courier is assigned once, by itself, when accepting the delivery");
        }
    }

    private void checkStatus(DeliveryEntity delivery, DeliveryState before, DeliveryState after,
                             CallerIdentity caller) {
        if (before.status() == after.status()) {
            return;
        }
        if (!WorkflowRules.DELIVERY.allows(before.status(), after.status())) {
            throw deny(String.format("Delivery cannot move from %s to %s", before.status(), after.status()));
        }
        if (caller != null && !WorkflowRules.DELIVERY.permits(
                before.status(), after.status(), WorkflowRules.relationsTo(caller, before))) {
            throw deny(String.format("%s may not move delivery %s from %s to %s",
                    caller.getUserId(), delivery.getId(), before.status(), after.status()));
        }
        if (after.status() == DeliveryStatus.ASSIGNED) {
            if (before.paymentStatus() != DeliveryPaymentStatus.PAYMENT_COMPLETE) {
                throw deny("Delivery " + delivery.getId() + " is not fully paid");
            }
            if (!serviceArea.serves(after.courierId(), after.cityId())) {
                throw deny("Courier " + after.courierId() + " does not serve " + after.cityId());
            }
        }
    }

    private void checkPartyPayment(DeliveryState before, PartyPaymentStatus was, PartyPaymentStatus now,
                                   String partyId, CallerIdentity caller) {
        if (was == now) {
            return;
        }
        if (was == PartyPaymentStatus.PENDING && now == PartyPaymentStatus.PAID) {
            if (caller != null && !caller.is(partyId)) {
                throw deny("Only " + partyId + " can pay its half of the delivery fee");
            }
            if (before.status() != DeliveryStatus.PENDING) {
                throw deny("Delivery fees are paid before a courier is assigned");
            }
            return;
        }
        if (was == PartyPaymentStatus.PAID && now == PartyPaymentStatus.REFUNDED) {
            if (caller != null && !caller.isAdmin()) {
                throw deny("Only an administrator can refund a delivery payment");
            }
            if (before.paymentStatus() == DeliveryPaymentStatus.RELEASED_TO_COURIER) {
                throw deny("Delivery payment was already released to the courier");
            }
            return;
        }
        throw deny(String.format("Party payment cannot move from %s to %s", was, now));
    }

    private static PolicyViolationException deny(String message) {
        log.warn("Delivery write rejected: {}", message);
        return new PolicyViolationException(message);
    }
}
