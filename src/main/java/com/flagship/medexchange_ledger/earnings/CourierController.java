package com.flagship.medexchange_ledger.earnings;

import com.flagship.medexchange_ledger.earnings.dto.CourierWalletResponse;
import com.flagship.medexchange_ledger.earnings.dto.CreatePayoutRequest;
import com.flagship.medexchange_ledger.earnings.dto.PayoutResponse;
import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.security.CallerContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/courier")
@RequiredArgsConstructor
@Slf4j
public class CourierController {

    private final PayoutService payoutService;
    private final EarningsService earningsService;
    private final CourierWalletService walletService;

    @PostMapping("/payouts")
    public ResponseEntity<PayoutResponse> requestPayout(@Valid @RequestBody CreatePayoutRequest request) {
        String courierId = CallerContext.requireCourier().getUserId();
        log.info("Payout requested: amount={}, currency={}, destination={}",
                request.getAmount(), request.getCurrency(), request.getDestinationType());
        return ResponseEntity.status(HttpStatus.CREATED).body(payoutService.requestPayout(courierId, request));
    }

    @GetMapping("/payouts")
    public ResponseEntity<List<PayoutResponse>> recentPayouts() {
        String courierId = CallerContext.requireCourier().getUserId();
        return ResponseEntity.ok(payoutService.recentPayouts(courierId).stream()
                .map(PayoutResponse::from)
                .toList());
    }

    @GetMapping("/wallet")
    public ResponseEntity<CourierWalletResponse> wallet() {
        String courierId = CallerContext.requireCourier().getUserId();
        CourierWalletEntity wallet = walletService.find(courierId)
                .orElseThrow(() -> new NotFoundException("Courier wallet not found for " + courierId));
        return ResponseEntity.ok(CourierWalletResponse.from(wallet, earningsService.recentEarnings(courierId)));
    }
}
