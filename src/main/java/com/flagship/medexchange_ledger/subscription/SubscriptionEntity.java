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

import java.time.Duration;
import java.time.Instant;

/**
 * A party's current plan; one row per user, overwritten on each activation.
 */
@Entity
@Table(name = "subscriptions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SubscriptionEntity {

    private static final Duration RENEWAL_NOTICE = Duration.ofDays(7);

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "plan_id", nullable = false)
    private String planId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubscriptionTier tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubscriptionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false)
    private SubscriptionFunding paymentMethod;

    @Column(nullable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "provider_reference")
    private String providerReference;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "renew_at")
    private Instant renewAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static SubscriptionEntity forUser(String userId) {
        SubscriptionEntity entity = new SubscriptionEntity();
        entity.userId = userId;
        return entity;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        this.updatedAt = Instant.now();
    }

    /**
     * Starts {@code plan} now, replacing whatever was active. Paid plans get a
     * renewal reminder a week before expiry.
     */
    void activate(SubscriptionPlanEntity plan, SubscriptionFunding funding, String providerReference, Instant now) {
        this.planId = plan.getId();
        this.tier = plan.getTier();
        this.status = SubscriptionStatus.ACTIVE;
        this.paymentMethod = funding;
        this.amount = funding == SubscriptionFunding.FREE ? 0 : plan.getPrice();
        this.currency = plan.getCurrency();
        this.providerReference = providerReference;
        this.startedAt = now;
        this.expiresAt = now.plus(Duration.ofDays(plan.getDurationDays()));
        this.renewAt = plan.isFree() ? null : expiresAt.minus(RENEWAL_NOTICE);
    }
}
