package com.flagship.medexchange_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CreateSubscriptionPaymentRequest {

    @NotBlank(message = "Plan id is required")
    @JsonProperty("plan_id")
    String planId;
}
