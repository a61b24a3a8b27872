package com.flagship.medexchange_ledger.subscription;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionRequestRepository extends JpaRepository<SubscriptionRequestEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM SubscriptionRequestEntity r WHERE r.txRef = :txRef")
    Optional<SubscriptionRequestEntity> findByTxRefForUpdate(@Param("txRef") String txRef);

    boolean existsByUserIdAndPlanIdAndStatus(String userId, String planId, SubscriptionRequestStatus status);

    /**
     * A request of this user in one of {@code statuses}, identified by either our tx_ref or the
     * provider's reference, locked so that two activations cannot consume it together.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM SubscriptionRequestEntity r WHERE r.userId = :userId AND r.status IN :statuses " +
           "AND (r.providerReference = :reference OR r.txRef = :reference)")
    Optional<SubscriptionRequestEntity> lockByUserAndReference(@Param("userId") String userId,
                                                               @Param("reference") String reference,
                                                               @Param("statuses") Collection<SubscriptionRequestStatus> statuses);
}
