package com.flagship.medexchange_ledger.webhook;

import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.webhook.dto.ReceiptResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator view of callbacks that failed internally and were acknowledged anyway.
 */
@RestController
@RequestMapping("/api/admin/reconciliation")
@RequiredArgsConstructor
public class ReconciliationController {

    private final NotificationReceiptService receiptService;

    @GetMapping
    public ResponseEntity<List<ReceiptResponse>> awaitingReconciliation() {
        CallerContext.requireAdmin();
        return ResponseEntity.ok(receiptService.awaitingReconciliation().stream()
                .map(ReceiptResponse::from)
                .toList());
    }
}
