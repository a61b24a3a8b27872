package com.flagship.medexchange_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class DeliveryCodeRequest {

    @NotBlank(message = "code is required")
    @JsonProperty("code")
    String code;
}
