package com.flagship.medexchange_ledger.earnings;

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
 * A courier withdrawal. PENDING until the provider accepts the transfer,
 * PROCESSING until it reports the outcome.
 */
@Entity
@Table(name = "courier_payouts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CourierPayoutEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "courier_id", nullable = false, updatable = false)
    private String courierId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(nullable = false, updatable = false)
    private long fee;

    @Column(name = "net_amount", nullable = false, updatable = false)
    private long netAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PayoutStatus status;

    @Column(nullable = false, unique = true, updatable = false)
    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(name = "destination_type", nullable = false, updatable = false)
    private PayoutDestination destinationType;

    @Column(name = "account_number", nullable = false, updatable = false)
    private String accountNumber;

    @Column(name = "bank_code", updatable = false)
    private String bankCode;

    @Column(name = "account_name", updatable = false)
    private String accountName;

    @Column(name = "provider_transfer_id")
    private String providerTransferId;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private Instant requestedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static CourierPayoutEntity create(String courierId, long amount, long fee, CurrencyCode currency,
                                      String reference, PayoutDestination destinationType,
                                      String accountNumber, String bankCode, String accountName) {
        CourierPayoutEntity entity = new CourierPayoutEntity();
        entity.id = UUID.randomUUID();
        entity.courierId = courierId;
        entity.amount = amount;
        entity.fee = fee;
        entity.netAmount = amount - fee;
        entity.currency = currency;
        entity.status = PayoutStatus.PENDING;
        entity.reference = reference;
        entity.destinationType = destinationType;
        entity.accountNumber = accountNumber;
        entity.bankCode = bankCode;
        entity.accountName = accountName;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.requestedAt = Instant.now();
        this.updatedAt = this.requestedAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    void markProcessing(String providerTransferId) {
        // A fast callback may already have settled the payout
        if (status == PayoutStatus.PENDING) {
            this.status = PayoutStatus.PROCESSING;
        }
        this.providerTransferId = providerTransferId;
    }

    void markCompleted(String providerTransferId, Instant completedAt) {
        requireOpen();
        this.status = PayoutStatus.COMPLETED;
        if (providerTransferId != null) {
            this.providerTransferId = providerTransferId;
        }
        this.completedAt = completedAt;
    }

    void markFailed(String reason) {
        requireOpen();
        this.status = PayoutStatus.FAILED;
        this.failureReason = reason;
    }

    private void requireOpen() {
        if (!status.isOpen()) {
            throw new IllegalStateException("Payout " + reference + " is already " + status);
        }
    }
}
