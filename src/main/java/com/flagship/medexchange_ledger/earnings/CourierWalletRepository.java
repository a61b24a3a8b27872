package com.flagship.medexchange_ledger.earnings;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CourierWalletRepository extends JpaRepository<CourierWalletEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM CourierWalletEntity w WHERE w.courierId = :courierId")
    Optional<CourierWalletEntity> findByIdForUpdate(@Param("courierId") String courierId);

    /**
     * Creates an empty wallet unless one exists. Safe under concurrent first earnings.
     */
    @Modifying
    @Query(value = "INSERT INTO courier_wallets (courier_id, currency, balance, pending, available, " +
                   "total_earned, total_paid_out, created_at, updated_at) " +
                   "VALUES (:courierId, :currency, 0, 0, 0, 0, 0, now(), now()) " +
                   "ON CONFLICT (courier_id) DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(@Param("courierId") String courierId, @Param("currency") String currency);
}
