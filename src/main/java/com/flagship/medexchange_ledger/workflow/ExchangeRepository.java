package com.flagship.medexchange_ledger.workflow;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExchangeRepository extends JpaRepository<ExchangeEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM ExchangeEntity e WHERE e.id = :id")
    Optional<ExchangeEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Open exchanges of a city that nobody has responded to yet.
     */
    @Query("SELECT e FROM ExchangeEntity e WHERE e.location.cityId = :cityId " +
           "AND e.status = com.flagship.medexchange_ledger.workflow.ExchangeStatus.PENDING " +
           "AND e.responderId IS NULL ORDER BY e.createdAt DESC")
    List<ExchangeEntity> findOpenInCity(@Param("cityId") String cityId);
}
