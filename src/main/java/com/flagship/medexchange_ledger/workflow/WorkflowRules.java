package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.security.CallerIdentity;
import com.flagship.medexchange_ledger.security.CallerRole;

import java.util.EnumSet;
import java.util.Set;

/**
 * Who may move an exchange or a delivery from one status to another, who may
 * see an exchange, and how the two party payments add up to the delivery's
 * payment status.
 *
 * Both the services and the persistence write policies evaluate these rules,
 * so a write that skips the service layer is held to the same table.
 */
public final class WorkflowRules {

    public static final TransitionTable<ExchangeStatus> EXCHANGE = TransitionTable.builder(ExchangeStatus.class)
            .allow(ExchangeStatus.DRAFT, ExchangeStatus.PENDING, ActorRelation.REQUESTER)
            .allow(ExchangeStatus.REJECTED, ExchangeStatus.PENDING, ActorRelation.REQUESTER)
            .allow(ExchangeStatus.PENDING, ExchangeStatus.ACCEPTED, ActorRelation.RESPONDER)
            .allow(ExchangeStatus.PENDING, ExchangeStatus.REJECTED, ActorRelation.RESPONDER)
            .allow(ExchangeStatus.ACCEPTED, ExchangeStatus.IN_TRANSIT, ActorRelation.ASSIGNED_COURIER)
            .allow(ExchangeStatus.IN_TRANSIT, ExchangeStatus.COMPLETED, ActorRelation.ASSIGNED_COURIER)
            .build();

    public static final TransitionTable<DeliveryStatus> DELIVERY = TransitionTable.builder(DeliveryStatus.class)
            .allow(DeliveryStatus.PENDING, DeliveryStatus.ASSIGNED, ActorRelation.COURIER)
            .allow(DeliveryStatus.ASSIGNED, DeliveryStatus.PICKED_UP, ActorRelation.ASSIGNED_COURIER)
            .allow(DeliveryStatus.PICKED_UP, DeliveryStatus.IN_TRANSIT, ActorRelation.ASSIGNED_COURIER)
            .allow(DeliveryStatus.IN_TRANSIT, DeliveryStatus.DELIVERED, ActorRelation.ASSIGNED_COURIER)
            .allow(DeliveryStatus.IN_TRANSIT, DeliveryStatus.FAILED, ActorRelation.ASSIGNED_COURIER)
            .allow(DeliveryStatus.PENDING, DeliveryStatus.CANCELLED, ActorRelation.PAYING_PARTY, ActorRelation.ADMINISTRATOR)
            .allow(DeliveryStatus.ASSIGNED, DeliveryStatus.CANCELLED, ActorRelation.PAYING_PARTY, ActorRelation.ADMINISTRATOR)
            .build();

    private WorkflowRules() {
    }

    public static Set<ActorRelation> relationsTo(CallerIdentity caller, ExchangeState exchange) {
        Set<ActorRelation> relations = EnumSet.noneOf(ActorRelation.class);
        if (caller == null) {
            return relations;
        }
        if (caller.isAdmin()) {
            relations.add(ActorRelation.ADMINISTRATOR);
        }
        if (caller.is(exchange.requesterId())) {
            relations.add(ActorRelation.REQUESTER);
        } else if (caller.getRole() == CallerRole.PARTY) {
            boolean responder = exchange.responderId() == null
                    ? sameCity(caller, exchange.cityId())
                    : caller.is(exchange.responderId());
            if (responder) {
                relations.add(ActorRelation.RESPONDER);
            }
        }
        if (caller.isCourier()) {
            relations.add(ActorRelation.COURIER);
            if (caller.is(exchange.courierId())) {
                relations.add(ActorRelation.ASSIGNED_COURIER);
            }
        }
        return relations;
    }

    public static Set<ActorRelation> relationsTo(CallerIdentity caller, DeliveryState delivery) {
        Set<ActorRelation> relations = EnumSet.noneOf(ActorRelation.class);
        if (caller == null) {
            return relations;
        }
        if (caller.isAdmin()) {
            relations.add(ActorRelation.ADMINISTRATOR);
        }
        if (caller.is(delivery.fromPartyId()) || caller.is(delivery.toPartyId())) {
            relations.add(ActorRelation.PAYING_PARTY);
        }
        if (caller.isCourier()) {
            relations.add(ActorRelation.COURIER);
            if (caller.is(delivery.courierId())) {
                relations.add(ActorRelation.ASSIGNED_COURIER);
            }
        }
        return relations;
    }

    /**
     * An open exchange without a responder is visible to every party of its
     * city. Once a responder is attached only the two parties and
     * administrators see it.
     */
    public static boolean canView(CallerIdentity caller, ExchangeState exchange) {
        if (caller.isAdmin() || caller.is(exchange.requesterId())) {
            return true;
        }
        if (exchange.responderId() != null) {
            return caller.is(exchange.responderId());
        }
        return exchange.status() == ExchangeStatus.PENDING
                && caller.getRole() == CallerRole.PARTY
                && sameCity(caller, exchange.cityId());
    }

    /**
     * Payment status implied by the two party payments. Funds are released to
     * the courier once both sides paid and the delivery succeeded.
     */
    public static DeliveryPaymentStatus paymentStatusFor(PartyPaymentStatus from, PartyPaymentStatus to,
                                                         DeliveryStatus deliveryStatus) {
        if (from == PartyPaymentStatus.REFUNDED || to == PartyPaymentStatus.REFUNDED) {
            return DeliveryPaymentStatus.REFUNDED;
        }
        int paid = (from == PartyPaymentStatus.PAID ? 1 : 0) + (to == PartyPaymentStatus.PAID ? 1 : 0);
        if (paid == 2) {
            return deliveryStatus == DeliveryStatus.DELIVERED
                    ? DeliveryPaymentStatus.RELEASED_TO_COURIER
                    : DeliveryPaymentStatus.PAYMENT_COMPLETE;
        }
        return paid == 1 ? DeliveryPaymentStatus.PARTIAL_PAYMENT : DeliveryPaymentStatus.AWAITING_PAYMENT;
    }

    private static boolean sameCity(CallerIdentity caller, String cityId) {
        return caller.getCityId() != null && caller.getCityId().equals(cityId);
    }
}
