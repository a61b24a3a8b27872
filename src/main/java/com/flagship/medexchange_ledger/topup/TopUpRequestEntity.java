package com.flagship.medexchange_ledger.topup;

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
 * A wallet top-up awaiting the provider's notification.
 *
 * Created before the provider is contacted; moves PENDING to COMPLETED or
 * FAILED exactly once. No setters: state changes go through the mark methods,
 * which refuse to leave a terminal state.
 */
@Entity
@Table(name = "topup_requests")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TopUpRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tx_ref", nullable = false, unique = true, updatable = false)
    private String txRef;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    // Smallest currency units
    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false)
    private PaymentMethod paymentMethod;

    @Column(name = "phone_number", updatable = false)
    private String phoneNumber;

    @Column(name = "mobile_network", updatable = false)
    private String mobileNetwork;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TopUpStatus status;

    @Column(name = "provider_reference")
    private String providerReference;

    @Column(name = "payment_link")
    private String paymentLink;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static TopUpRequestEntity create(String txRef, String userId, long amount, CurrencyCode currency,
                                     PaymentMethod paymentMethod, String phoneNumber, String mobileNetwork,
                                     Instant expiresAt) {
        TopUpRequestEntity entity = new TopUpRequestEntity();
        entity.id = UUID.randomUUID();
        entity.txRef = txRef;
        entity.userId = userId;
        entity.amount = amount;
        entity.currency = currency;
        entity.paymentMethod = paymentMethod;
        entity.phoneNumber = phoneNumber;
        entity.mobileNetwork = mobileNetwork;
        entity.status = TopUpStatus.PENDING;
        entity.expiresAt = expiresAt;
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
        return status == TopUpStatus.PENDING;
    }

    void attachProviderResponse(String providerReference, String paymentLink) {
        this.providerReference = providerReference;
        this.paymentLink = paymentLink;
    }

    void markCompleted(String providerTxId) {
        requirePending();
        this.status = TopUpStatus.COMPLETED;
        this.providerReference = providerTxId;
        this.completedAt = Instant.now();
    }

    void markFailed(String reason) {
        requirePending();
        this.status = TopUpStatus.FAILED;
        this.failureReason = reason;
    }

    private void requirePending() {
        if (status != TopUpStatus.PENDING) {
            throw new IllegalStateException("Top-up " + txRef + " is already " + status);
        }
    }
}
