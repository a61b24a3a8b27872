package com.flagship.medexchange_ledger.earnings;

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
public interface CourierPayoutRepository extends JpaRepository<CourierPayoutEntity, UUID> {

    boolean existsByCourierIdAndStatusIn(String courierId, Collection<PayoutStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM CourierPayoutEntity p WHERE p.reference = :reference")
    Optional<CourierPayoutEntity> findByReferenceForUpdate(@Param("reference") String reference);

    Optional<CourierPayoutEntity> findByReference(String reference);

    List<CourierPayoutEntity> findTop20ByCourierIdOrderByRequestedAtDesc(String courierId);
}
