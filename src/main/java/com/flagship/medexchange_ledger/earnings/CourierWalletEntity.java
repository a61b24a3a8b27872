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

/**
 * Courier balances, all in smallest units.
 *
 * - balance: total earned minus total paid out
 * - pending: earnings still inside the release window
 * - available: matured earnings not reserved by a payout
 *
 * Every mutator refuses to drive a bucket negative; the table's CHECK
 * constraint backs this up. Callers hold a row lock from
 * {@link CourierWalletRepository#findByIdForUpdate}.
 */
@Entity
@Table(name = "courier_wallets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CourierWalletEntity {

    @Id
    @Column(name = "courier_id", nullable = false, updatable = false)
    private String courierId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(nullable = false)
    private long balance;

    @Column(nullable = false)
    private long pending;

    @Column(nullable = false)
    private long available;

    @Column(name = "total_earned", nullable = false)
    private long totalEarned;

    @Column(name = "total_paid_out", nullable = false)
    private long totalPaidOut;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    void recordEarning(long amount) {
        this.pending = Math.addExact(pending, amount);
        this.balance = Math.addExact(balance, amount);
        this.totalEarned = Math.addExact(totalEarned, amount);
    }

    void release(long amount) {
        requireCovered(pending, amount, "pending");
        this.pending -= amount;
        this.available = Math.addExact(available, amount);
    }

    void reserveForPayout(long amount) {
        requireCovered(available, amount, "available");
        this.available -= amount;
    }

    // Compensation for a payout the provider did not complete
    void restoreReservation(long amount) {
        this.available = Math.addExact(available, amount);
    }

    void settlePayout(long amount) {
        requireCovered(balance, amount, "balance");
        this.balance -= amount;
        this.totalPaidOut = Math.addExact(totalPaidOut, amount);
    }

    private void requireCovered(long bucket, long amount, String name) {
        if (bucket < amount) {
            throw new IllegalStateException(String.format(
                    "Courier %s %s %d cannot cover %d", courierId, name, bucket, amount));
        }
    }
}
