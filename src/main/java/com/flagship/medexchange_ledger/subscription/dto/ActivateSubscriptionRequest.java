package com.flagship.medexchange_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * {@code payment_method} is {@code wallet} or {@code external}; it is ignored for free plans.
 * {@code payment_reference} identifies the completed external payment.
 */
@Value
public class ActivateSubscriptionRequest {

    @NotBlank(message = "Plan id is required")
    @JsonProperty("plan_id")
    String planId;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("payment_reference")
    String paymentReference;
}
