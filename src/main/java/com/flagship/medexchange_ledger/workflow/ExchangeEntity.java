package com.flagship.medexchange_ledger.workflow;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A medicine swap between two parties of the same city.
 *
 * Status changes go through {@link #moveTo}; {@link ExchangeWritePolicy}
 * checks every flushed change against {@link WorkflowRules#EXCHANGE}.
 */
@Entity
@Table(name = "exchanges")
@EntityListeners(ExchangeWritePolicy.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExchangeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "requester_id", nullable = false)
    private String requesterId;

    @Column(name = "responder_id")
    private String responderId;

    @Column(name = "courier_id")
    private String courierId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExchangeStatus status;

    @Embedded
    private Location location;

    @Column
    private String notes;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "exchange_items", joinColumns = @JoinColumn(name = "exchange_id"))
    private List<ExchangeItem> items = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // State as last read from or written to the database
    @Transient
    private ExchangeState persistedState;

    @Transient
    private String overrideJustification;

    static ExchangeEntity create(String requesterId, Location location, String notes,
                                 List<ExchangeItem> items, ExchangeStatus initialStatus) {
        ExchangeEntity entity = new ExchangeEntity();
        entity.id = UUID.randomUUID();
        entity.requesterId = requesterId;
        entity.location = location;
        entity.notes = notes;
        entity.items = new ArrayList<>(items);
        entity.status = initialStatus;
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

    public ExchangeState currentState() {
        return ExchangeState.of(this);
    }

    void moveTo(ExchangeStatus target) {
        this.status = target;
    }

    void attachResponder(String responderId) {
        this.responderId = responderId;
    }

    void assignCourier(String courierId) {
        this.courierId = courierId;
    }

    /**
     * Administrative correction of fields no workflow step may change.
     */
    void override(String requesterId, Location location, String justification) {
        this.overrideJustification = justification;
        if (requesterId != null) {
            this.requesterId = requesterId;
        }
        if (location != null) {
            this.location = location;
        }
    }

    void rememberPersistedState() {
        this.persistedState = ExchangeState.of(this);
        this.overrideJustification = null;
    }
}
