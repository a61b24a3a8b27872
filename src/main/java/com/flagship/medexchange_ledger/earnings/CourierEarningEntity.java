package com.flagship.medexchange_ledger.earnings;

import com.flagship.medexchange_ledger.money.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * What a courier earned for one completed delivery. Amounts in smallest units.
 */
@Entity
@Table(name = "courier_earnings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CourierEarningEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "courier_id", nullable = false, updatable = false)
    private String courierId;

    @Column(name = "delivery_id", nullable = false, unique = true, updatable = false)
    private UUID deliveryId;

    @Column(name = "gross_amount", nullable = false, updatable = false)
    private long grossAmount;

    @Column(nullable = false, updatable = false)
    private long commission;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CourierEarningStatus status;

    @Column(name = "earned_at", nullable = false, updatable = false)
    private Instant earnedAt;

    @Column(name = "available_at", nullable = false, updatable = false)
    private Instant availableAt;

    @Column(name = "released_at")
    private Instant releasedAt;

    @Column(name = "paid_out_at")
    private Instant paidOutAt;

    @Column(name = "paid_out_amount", nullable = false)
    private long paidOutAmount;

    /**
     * Last payout that drew on this earning.
     */
    @Column(name = "payout_id")
    private UUID payoutId;

    static CourierEarningEntity create(String courierId, UUID deliveryId, long grossAmount, long commission,
                                       CurrencyCode currency, Instant earnedAt, Instant availableAt) {
        CourierEarningEntity entity = new CourierEarningEntity();
        entity.id = UUID.randomUUID();
        entity.courierId = courierId;
        entity.deliveryId = deliveryId;
        entity.grossAmount = grossAmount;
        entity.commission = commission;
        entity.amount = grossAmount - commission;
        entity.currency = currency;
        entity.status = CourierEarningStatus.PENDING;
        entity.earnedAt = earnedAt;
        entity.availableAt = availableAt;
        return entity;
    }

    void markAvailable(Instant releasedAt) {
        if (status != CourierEarningStatus.PENDING) {
            throw new IllegalStateException("Earning " + id + " is " + status + ", not PENDING");
        }
        this.status = CourierEarningStatus.AVAILABLE;
        this.releasedAt = releasedAt;
    }

    long getRemaining() {
        return amount - paidOutAmount;
    }

    /**
     * Draws up to {@code limit} from what is left of this earning. The earning
     * becomes PAID_OUT once nothing is left.
     *
     * @return the amount drawn
     */
    long drawForPayout(UUID payoutId, long limit, Instant paidOutAt) {
        if (status != CourierEarningStatus.AVAILABLE) {
            throw new IllegalStateException("Earning " + id + " is " + status + ", not AVAILABLE");
        }
        long drawn = Math.min(limit, getRemaining());
        if (drawn <= 0) {
            return 0;
        }
        this.paidOutAmount += drawn;
        this.payoutId = payoutId;
        if (paidOutAmount == amount) {
            this.status = CourierEarningStatus.PAID_OUT;
            this.paidOutAt = paidOutAt;
        }
        return drawn;
    }
}
