package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.workflow.dto.CourierProfileResponse;
import com.flagship.medexchange_ledger.workflow.dto.DeliveryReasonRequest;
import com.flagship.medexchange_ledger.workflow.dto.DeliveryResponse;
import com.flagship.medexchange_ledger.workflow.dto.ExchangeOverrideRequest;
import com.flagship.medexchange_ledger.workflow.dto.ExchangeResponse;
import com.flagship.medexchange_ledger.workflow.dto.RegisterCourierRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Administrator operations on exchanges, deliveries and courier service areas.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class WorkflowAdminController {

    private final ExchangeService exchangeService;
    private final DeliveryPaymentService paymentService;
    private final CourierProfileService courierProfileService;

    @PostMapping("/exchanges/{id}/override")
    public ExchangeResponse overrideExchange(@PathVariable UUID id, @Valid @RequestBody ExchangeOverrideRequest request) {
        log.warn("Exchange {} override requested: {}", id, request.getJustification());
        return ExchangeResponse.from(exchangeService.override(id, request));
    }

    @PostMapping("/deliveries/{id}/refund")
    public DeliveryResponse refundDelivery(@PathVariable UUID id, @Valid @RequestBody DeliveryReasonRequest request) {
        return DeliveryResponse.from(paymentService.refund(id, request.getReason()), true);
    }

    @PutMapping("/couriers/{courierId}")
    public CourierProfileResponse registerCourier(@PathVariable String courierId,
                                                  @Valid @RequestBody RegisterCourierRequest request) {
        return CourierProfileResponse.from(courierProfileService.register(courierId, request));
    }

    @GetMapping("/couriers/{courierId}")
    public CourierProfileResponse courier(@PathVariable String courierId) {
        return CourierProfileResponse.from(courierProfileService.get(courierId));
    }
}
