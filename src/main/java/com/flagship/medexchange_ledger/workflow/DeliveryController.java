package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import com.flagship.medexchange_ledger.workflow.dto.DeliveryCodeRequest;
import com.flagship.medexchange_ledger.workflow.dto.DeliveryReasonRequest;
import com.flagship.medexchange_ledger.workflow.dto.DeliveryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/deliveries")
@RequiredArgsConstructor
public class DeliveryController {

    private final DeliveryService deliveryService;
    private final DeliveryPaymentService paymentService;

    @GetMapping("/{id}")
    public DeliveryResponse get(@PathVariable UUID id) {
        return respond(deliveryService.getVisible(id));
    }

    /**
     * Paid deliveries waiting for a courier in the caller's service cities.
     */
    @GetMapping("/available")
    public List<DeliveryResponse> available() {
        return deliveryService.acceptableForCaller().stream()
                .map(delivery -> DeliveryResponse.from(delivery, false))
                .toList();
    }

    @PostMapping("/{id}/pay")
    public DeliveryResponse pay(@PathVariable UUID id) {
        return respond(paymentService.pay(id));
    }

    @PostMapping("/{id}/accept")
    public DeliveryResponse accept(@PathVariable UUID id) {
        return respond(deliveryService.accept(id));
    }

    @PostMapping("/{id}/pick-up")
    public DeliveryResponse pickUp(@PathVariable UUID id, @Valid @RequestBody DeliveryCodeRequest request) {
        return respond(deliveryService.pickUp(id, request.getCode()));
    }

    @PostMapping("/{id}/in-transit")
    public DeliveryResponse inTransit(@PathVariable UUID id) {
        return respond(deliveryService.startTransit(id));
    }

    @PostMapping("/{id}/deliver")
    public DeliveryResponse deliver(@PathVariable UUID id, @Valid @RequestBody DeliveryCodeRequest request) {
        return respond(deliveryService.deliver(id, request.getCode()));
    }

    @PostMapping("/{id}/fail")
    public DeliveryResponse fail(@PathVariable UUID id, @Valid @RequestBody DeliveryReasonRequest request) {
        return respond(deliveryService.fail(id, request.getReason()));
    }

    @PostMapping("/{id}/cancel")
    public DeliveryResponse cancel(@PathVariable UUID id, @Valid @RequestBody DeliveryReasonRequest request) {
        return respond(deliveryService.cancel(id, request.getReason()));
    }

    private static DeliveryResponse respond(DeliveryEntity delivery) {
        CallerIdentity caller = CallerContext.require();
        boolean includeCodes = caller.isAdmin() || delivery.isPartyTo(caller.getUserId());
        return DeliveryResponse.from(delivery, includeCodes);
    }
}
