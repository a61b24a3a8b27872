package com.flagship.medexchange_ledger.subscription;

import com.flagship.medexchange_ledger.money.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * An externally paid subscription charge. Completed by the provider's
 * notification, then consumed by an external activation.
 */
@Entity
@Table(name = "subscription_requests")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SubscriptionRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "plan_id", nullable = false, updatable = false)
    private String planId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "tx_ref", nullable = false, unique = true, updatable = false)
    private String txRef;

    @Column(name = "provider_reference")
    private String providerReference;

    @Column(name = "payment_link")
    private String paymentLink;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubscriptionRequestStatus status;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static SubscriptionRequestEntity create(String userId, SubscriptionPlanEntity plan, String txRef) {
        SubscriptionRequestEntity entity = new SubscriptionRequestEntity();
        entity.id = UUID.randomUUID();
        entity.userId = userId;
        entity.planId = plan.getId();
        entity.amount = plan.getPrice();
        entity.currency = plan.getCurrency();
        entity.txRef = txRef;
        entity.status = SubscriptionRequestStatus.PENDING;
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

    public boolean isPending() {
        return status == SubscriptionRequestStatus.PENDING;
    }

    void attachPaymentLink(String providerReference, String paymentLink) {
        this.providerReference = providerReference;
        this.paymentLink = paymentLink;
    }

    void markCompleted(String providerTxId, Instant completedAt) {
        if (!isPending()) {
            throw new IllegalStateException("Subscription request " + txRef + " is already " + status);
        }
        this.status = SubscriptionRequestStatus.COMPLETED;
        this.providerReference = providerTxId;
        this.completedAt = completedAt;
    }

    void markConsumed() {
        if (status != SubscriptionRequestStatus.COMPLETED) {
            throw new IllegalStateException("Subscription request " + txRef + " is " + status + ", not COMPLETED");
        }
        this.status = SubscriptionRequestStatus.CONSUMED;
    }

    void markFailed(String reason) {
        if (!isPending()) {
            throw new IllegalStateException("Subscription request " + txRef + " is already " + status);
        }
        this.status = SubscriptionRequestStatus.FAILED;
        this.failureReason = reason;
    }
}
