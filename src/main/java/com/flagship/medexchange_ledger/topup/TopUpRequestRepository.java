package com.flagship.medexchange_ledger.topup;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TopUpRequestRepository extends JpaRepository<TopUpRequestEntity, UUID> {

    Optional<TopUpRequestEntity> findByTxRef(String txRef);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TopUpRequestEntity t WHERE t.txRef = :txRef")
    Optional<TopUpRequestEntity> findByTxRefForUpdate(@Param("txRef") String txRef);

}
