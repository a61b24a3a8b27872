package com.flagship.medexchange_ledger.workflow;

import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One party's half of a delivery fee. Column names are set per side by the owning entity.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PartyPayment {

    @Enumerated(EnumType.STRING)
    private PartyPaymentStatus status;

    private Instant paidAt;

    private UUID ledgerEntryId;

    static PartyPayment pending() {
        PartyPayment payment = new PartyPayment();
        payment.status = PartyPaymentStatus.PENDING;
        return payment;
    }

    public boolean isPaid() {
        return status == PartyPaymentStatus.PAID;
    }

    void markPaid(UUID ledgerEntryId, Instant paidAt) {
        this.status = PartyPaymentStatus.PAID;
        this.ledgerEntryId = ledgerEntryId;
        this.paidAt = paidAt;
    }

    void markRefunded() {
        this.status = PartyPaymentStatus.REFUNDED;
    }
}
