package com.flagship.medexchange_ledger.earnings;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CourierEarningRepository extends JpaRepository<CourierEarningEntity, UUID> {

    Optional<CourierEarningEntity> findByDeliveryId(UUID deliveryId);

    /**
     * One release batch: matured PENDING earnings, oldest first.
     */
    @Query("SELECT e FROM CourierEarningEntity e WHERE e.status = :status AND e.earnedAt <= :cutoff " +
           "ORDER BY e.earnedAt ASC")
    List<CourierEarningEntity> findMatured(@Param("status") CourierEarningStatus status,
                                           @Param("cutoff") Instant cutoff,
                                           Pageable page);

    /**
     * Re-reads a courier's batch under row locks, keeping only rows still in {@code status}.
     * An overlapping release run that got there first leaves nothing to re-credit.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM CourierEarningEntity e WHERE e.id IN :ids AND e.courierId = :courierId " +
           "AND e.status = :status")
    List<CourierEarningEntity> lockByIdsInStatus(@Param("courierId") String courierId,
                                                 @Param("ids") Collection<UUID> ids,
                                                 @Param("status") CourierEarningStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM CourierEarningEntity e WHERE e.courierId = :courierId AND e.status = :status " +
           "ORDER BY e.earnedAt ASC")
    List<CourierEarningEntity> lockByCourierInStatus(@Param("courierId") String courierId,
                                                     @Param("status") CourierEarningStatus status);

    List<CourierEarningEntity> findTop50ByCourierIdOrderByEarnedAtDesc(String courierId);

}
