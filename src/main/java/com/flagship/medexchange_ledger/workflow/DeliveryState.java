package com.flagship.medexchange_ledger.workflow;

import java.util.UUID;

/**
 * The authorization-relevant fields of a delivery at one point in time.
 */
public record DeliveryState(UUID exchangeId,
                            String fromPartyId,
                            String toPartyId,
                            String courierId,
                            String cityId,
                            DeliveryStatus status,
                            DeliveryPaymentStatus paymentStatus,
                            PartyPaymentStatus fromPaymentStatus,
                            PartyPaymentStatus toPaymentStatus,
                            long fee,
                            long feePerParty) {

    static DeliveryState of(DeliveryEntity delivery) {
        return new DeliveryState(
                delivery.getExchangeId(),
                delivery.getFromPartyId(),
                delivery.getToPartyId(),
                delivery.getCourierId(),
                delivery.getLocation().getCityId(),
                delivery.getStatus(),
                delivery.getPaymentStatus(),
                delivery.getFromPayment().getStatus(),
                delivery.getToPayment().getStatus(),
                delivery.getFee(),
                delivery.getFeePerParty());
    }
}
