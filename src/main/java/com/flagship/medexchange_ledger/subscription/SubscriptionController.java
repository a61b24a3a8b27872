package com.flagship.medexchange_ledger.subscription;

import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import com.flagship.medexchange_ledger.subscription.dto.ActivateSubscriptionRequest;
import com.flagship.medexchange_ledger.subscription.dto.CreateSubscriptionPaymentRequest;
import com.flagship.medexchange_ledger.subscription.dto.SubscriptionPaymentRequestResponse;
import com.flagship.medexchange_ledger.subscription.dto.SubscriptionPlanResponse;
import com.flagship.medexchange_ledger.subscription.dto.SubscriptionResponse;
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
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
@Slf4j
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @GetMapping("/plans")
    public List<SubscriptionPlanResponse> plans() {
        return subscriptionService.activePlans().stream()
                .map(SubscriptionPlanResponse::from)
                .toList();
    }

    @GetMapping
    public SubscriptionResponse current() {
        CallerIdentity caller = CallerContext.require();
        return subscriptionService.currentSubscription(caller.getUserId())
                .map(SubscriptionResponse::from)
                .orElseThrow(() -> new NotFoundException("No subscription for " + caller.getUserId()));
    }

    @PostMapping("/activate")
    public SubscriptionResponse activate(@Valid @RequestBody ActivateSubscriptionRequest request) {
        CallerIdentity caller = CallerContext.require();
        log.info("Subscription activation requested: plan={}, method={}", request.getPlanId(), request.getPaymentMethod());
        return subscriptionService.activate(caller.getUserId(), request);
    }

    @PostMapping("/payment-requests")
    public ResponseEntity<SubscriptionPaymentRequestResponse> requestPayment(
            @Valid @RequestBody CreateSubscriptionPaymentRequest request) {
        CallerIdentity caller = CallerContext.require();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(subscriptionService.requestExternalPayment(caller.getUserId(), request.getPlanId()));
    }
}
