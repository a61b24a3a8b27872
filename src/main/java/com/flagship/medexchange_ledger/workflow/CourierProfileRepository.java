package com.flagship.medexchange_ledger.workflow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CourierProfileRepository extends JpaRepository<CourierProfileEntity, String> {
}
