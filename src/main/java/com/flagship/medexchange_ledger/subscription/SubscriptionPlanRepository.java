package com.flagship.medexchange_ledger.subscription;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlanEntity, String> {

    Optional<SubscriptionPlanEntity> findByIdAndActiveTrue(String id);

    List<SubscriptionPlanEntity> findByActiveTrueOrderByPriceAsc();
}
