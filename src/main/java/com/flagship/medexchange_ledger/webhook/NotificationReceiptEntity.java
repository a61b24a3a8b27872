package com.flagship.medexchange_ledger.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable record that a provider callback was triaged, and how.
 */
@Entity
@Immutable
@Table(name = "notification_receipts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationReceiptEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String provider;

    @Column(name = "provider_tx_id")
    private String providerTxId;

    @Column(name = "event_type", nullable = false)
    private String eventType;

    @Column(name = "tx_ref")
    private String txRef;

    @Column
    private String purpose;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private NotificationOutcome outcome;

    @Column(name = "needs_reconciliation", nullable = false)
    private boolean needsReconciliation;

    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    static NotificationReceiptEntity create(String provider, PaymentNotification notification,
                                            NotificationOutcome outcome, String errorMessage) {
        NotificationReceiptEntity entity = new NotificationReceiptEntity();
        entity.id = UUID.randomUUID();
        entity.provider = provider;
        entity.providerTxId = notification.getData() != null ? notification.getData().getId() : null;
        entity.eventType = notification.getEvent();
        entity.txRef = notification.ourReference();
        entity.purpose = notification.purpose();
        entity.outcome = outcome;
        entity.needsReconciliation = outcome == NotificationOutcome.FAILED;
        entity.errorMessage = errorMessage;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.receivedAt = Instant.now();
    }
}
