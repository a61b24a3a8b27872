package com.flagship.medexchange_ledger.workflow;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A courier's service area: the cities whose deliveries it may accept.
 */
@Entity
@Table(name = "courier_profiles")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CourierProfileEntity {

    @Id
    @Column(name = "courier_id", nullable = false, updatable = false)
    private String courierId;

    @Column(name = "country_code", nullable = false, length = 2)
    private String countryCode;

    @Column(nullable = false)
    private boolean active;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "courier_service_cities", joinColumns = @JoinColumn(name = "courier_id"))
    @Column(name = "city_id", nullable = false)
    private Set<String> serviceCities = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static CourierProfileEntity create(String courierId, String countryCode, Set<String> serviceCities) {
        CourierProfileEntity entity = new CourierProfileEntity();
        entity.courierId = courierId;
        entity.countryCode = countryCode;
        entity.active = true;
        entity.serviceCities = new HashSet<>(serviceCities);
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    void updateServiceArea(Set<String> serviceCities, boolean active) {
        this.serviceCities.clear();
        this.serviceCities.addAll(serviceCities);
        this.active = active;
    }
}
