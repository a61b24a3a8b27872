package com.flagship.medexchange_ledger.topup;

import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import com.flagship.medexchange_ledger.topup.dto.CreateTopUpRequest;
import com.flagship.medexchange_ledger.topup.dto.TopUpResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/wallet/top-ups")
@RequiredArgsConstructor
@Slf4j
public class TopUpController {

    private final TopUpService topUpService;

    /**
     * Starts a top-up. The wallet is credited later, when the provider notifies us.
     */
    @PostMapping
    public ResponseEntity<TopUpResponse> requestTopUp(@Valid @RequestBody CreateTopUpRequest request) {
        CallerIdentity caller = CallerContext.require();
        log.info("Top-up requested: amount={}, currency={}, method={}",
                request.getAmount(), request.getCurrency(), request.getPaymentMethod());
        return ResponseEntity.status(HttpStatus.CREATED).body(topUpService.requestTopUp(caller.getUserId(), request));
    }
}
