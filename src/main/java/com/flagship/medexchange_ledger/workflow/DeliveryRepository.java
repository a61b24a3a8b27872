package com.flagship.medexchange_ledger.workflow;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DeliveryRepository extends JpaRepository<DeliveryEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DeliveryEntity d WHERE d.id = :id")
    Optional<DeliveryEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<DeliveryEntity> findByExchangeId(UUID exchangeId);

    /**
     * Paid, unassigned deliveries in the given cities: what a courier may pick from.
     */
    @Query("SELECT d FROM DeliveryEntity d WHERE d.location.cityId IN :cityIds " +
           "AND d.status = com.flagship.medexchange_ledger.workflow.DeliveryStatus.PENDING " +
           "AND d.paymentStatus = com.flagship.medexchange_ledger.workflow.DeliveryPaymentStatus.PAYMENT_COMPLETE " +
           "ORDER BY d.createdAt ASC")
    List<DeliveryEntity> findAcceptableInCities(@Param("cityIds") Collection<String> cityIds);
}
