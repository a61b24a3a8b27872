package com.flagship.medexchange_ledger.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationReceiptRepository extends JpaRepository<NotificationReceiptEntity, UUID> {

    List<NotificationReceiptEntity> findByNeedsReconciliationTrueOrderByReceivedAtAsc();

    long countByNeedsReconciliationTrue();

    List<NotificationReceiptEntity> findByProviderTxIdAndEventTypeOrderByReceivedAtAsc(String providerTxId,
                                                                                       String eventType);
}
