package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.money.CurrencyCode;
import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Courier job created once an exchange is accepted. Both parties pay half of
 * the fee; couriers only see and accept it once both halves are paid.
 */
@Entity
@Table(name = "deliveries")
@EntityListeners(DeliveryWritePolicy.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeliveryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "exchange_id", nullable = false, unique = true)
    private UUID exchangeId;

    @Column(name = "from_party_id", nullable = false)
    private String fromPartyId;

    @Column(name = "to_party_id", nullable = false)
    private String toPartyId;

    @Column(name = "courier_id")
    private String courierId;

    @Embedded
    private Location location;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeliveryStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false)
    private DeliveryPaymentStatus paymentStatus;

    @Column(nullable = false)
    private long fee;

    @Column(name = "fee_per_party", nullable = false)
    private long feePerParty;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "status", column = @Column(name = "from_payment_status", nullable = false)),
            @AttributeOverride(name = "paidAt", column = @Column(name = "from_paid_at")),
            @AttributeOverride(name = "ledgerEntryId", column = @Column(name = "from_ledger_entry_id"))
    })
    private PartyPayment fromPayment;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "status", column = @Column(name = "to_payment_status", nullable = false)),
            @AttributeOverride(name = "paidAt", column = @Column(name = "to_paid_at")),
            @AttributeOverride(name = "ledgerEntryId", column = @Column(name = "to_ledger_entry_id"))
    })
    private PartyPayment toPayment;

    @Column(name = "pickup_code", nullable = false)
    private String pickupCode;

    @Column(name = "delivery_code", nullable = false)
    private String deliveryCode;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "cancelled_by")
    private String cancelledBy;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "picked_up_at")
    private Instant pickedUpAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private DeliveryState persistedState;

    /**
     * The requester ships what it offered, so it is the sending party.
     */
    static DeliveryEntity forExchange(ExchangeEntity exchange, long fee, CurrencyCode currency,
                                      String pickupCode, String deliveryCode) {
        DeliveryEntity entity = new DeliveryEntity();
        entity.id = UUID.randomUUID();
        entity.exchangeId = exchange.getId();
        entity.fromPartyId = exchange.getRequesterId();
        entity.toPartyId = exchange.getResponderId();
        entity.location = Location.of(exchange.getLocation().getCityId(), exchange.getLocation().getCountryCode());
        entity.status = DeliveryStatus.PENDING;
        entity.fee = fee;
        entity.feePerParty = (fee + 1) / 2;
        entity.currency = currency;
        entity.fromPayment = PartyPayment.pending();
        entity.toPayment = PartyPayment.pending();
        entity.paymentStatus = DeliveryPaymentStatus.AWAITING_PAYMENT;
        entity.pickupCode = pickupCode;
        entity.deliveryCode = deliveryCode;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public DeliveryState currentState() {
        return DeliveryState.of(this);
    }

    public boolean isPaymentComplete() {
        return paymentStatus == DeliveryPaymentStatus.PAYMENT_COMPLETE;
    }

    public boolean isPartyTo(String userId) {
        return fromPartyId.equals(userId) || toPartyId.equals(userId);
    }

    /**
     * The payment record owned by {@code partyId}; never the counterparty's.
     */
    public PartyPayment paymentOf(String partyId) {
        if (fromPartyId.equals(partyId)) {
            return fromPayment;
        }
        if (toPartyId.equals(partyId)) {
            return toPayment;
        }
        throw new IllegalArgumentException(partyId + " is not a paying party of delivery " + id);
    }

    void recordPayment(String partyId, UUID ledgerEntryId, Instant paidAt) {
        paymentOf(partyId).markPaid(ledgerEntryId, paidAt);
        refreshPaymentStatus();
    }

    void refundPayment(String partyId) {
        paymentOf(partyId).markRefunded();
        refreshPaymentStatus();
    }

    void assign(String courierId, Instant at) {
        this.courierId = courierId;
        this.status = DeliveryStatus.ASSIGNED;
        this.assignedAt = at;
    }

    void markPickedUp(Instant at) {
        this.status = DeliveryStatus.PICKED_UP;
        this.pickedUpAt = at;
    }

    void markInTransit() {
        this.status = DeliveryStatus.IN_TRANSIT;
    }

    void markDelivered(Instant at) {
        this.status = DeliveryStatus.DELIVERED;
        this.completedAt = at;
        refreshPaymentStatus();
    }

    void markFailed(String reason, Instant at) {
        this.status = DeliveryStatus.FAILED;
        this.failureReason = reason;
        this.completedAt = at;
    }

    void cancel(String cancelledBy, String reason) {
        this.status = DeliveryStatus.CANCELLED;
        this.cancelledBy = cancelledBy;
        this.failureReason = reason;
    }

    void rememberPersistedState() {
        this.persistedState = DeliveryState.of(this);
    }

    private void refreshPaymentStatus() {
        this.paymentStatus = WorkflowRules.paymentStatusFor(fromPayment.getStatus(), toPayment.getStatus(), status);
    }
}
