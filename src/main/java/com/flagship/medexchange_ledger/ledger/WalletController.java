package com.flagship.medexchange_ledger.ledger;

import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.medexchange_ledger.ledger.dto.OpenWalletRequest;
import com.flagship.medexchange_ledger.ledger.dto.WalletResponse;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.security.CallerContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * The caller's own wallet. There is no way to read another party's wallet here.
 */
@RestController
@RequestMapping("/api/wallet")
@RequiredArgsConstructor
public class WalletController {

    private static final int MAX_LEDGER_PAGE = 200;

    private final WalletService walletService;
    private final LedgerService ledgerService;

    /**
     * Opens the caller's wallet. Idempotent: an existing wallet is returned unchanged.
     */
    @PostMapping
    public ResponseEntity<WalletResponse> openWallet(@Valid @RequestBody OpenWalletRequest request) {
        String userId = CallerContext.require().getUserId();
        CurrencyCode currency = CurrencyCode.fromCode(request.getCurrency())
                .orElseThrow(() -> new InvalidArgumentException("Unsupported currency: " + request.getCurrency()));
        return ResponseEntity.ok(WalletResponse.from(walletService.openWallet(userId, currency)));
    }

    @GetMapping
    public ResponseEntity<WalletResponse> getWallet() {
        String userId = CallerContext.require().getUserId();
        return ResponseEntity.ok(WalletResponse.from(walletService.getWallet(userId)));
    }

    @GetMapping("/ledger")
    public ResponseEntity<List<LedgerEntryResponse>> getLedger(
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        String userId = CallerContext.require().getUserId();
        int pageSize = Math.max(1, Math.min(limit, MAX_LEDGER_PAGE));
        return ResponseEntity.ok(ledgerService.entriesForUser(userId, pageSize).stream()
                .map(LedgerEntryResponse::from)
                .toList());
    }
}
