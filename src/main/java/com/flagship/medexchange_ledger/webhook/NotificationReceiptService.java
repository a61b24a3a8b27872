package com.flagship.medexchange_ledger.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Persists callback receipts in their own transaction, so a receipt for a
 * failed callback survives the rollback of the work it describes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationReceiptService {

    private final NotificationReceiptRepository repository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public NotificationReceiptEntity record(String provider, PaymentNotification notification,
                                            NotificationOutcome outcome, String errorMessage) {
        NotificationReceiptEntity receipt = repository.save(
                NotificationReceiptEntity.create(provider, notification, outcome, errorMessage));
        if (receipt.isNeedsReconciliation()) {
            log.error("Callback {} for {} needs reconciliation: {}",
                    notification.getEvent(), receipt.getProviderTxId(), errorMessage);
        }
        return receipt;
    }

    @Transactional(readOnly = true)
    public List<NotificationReceiptEntity> awaitingReconciliation() {
        return repository.findByNeedsReconciliationTrueOrderByReceivedAtAsc();
    }

    @Transactional(readOnly = true)
    public long countAwaitingReconciliation() {
        return repository.countByNeedsReconciliationTrue();
    }
}
