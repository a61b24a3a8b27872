package com.flagship.medexchange_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Value;

@Value
public class ExchangeItemRequest {

    @NotBlank(message = "Medicine id is required")
    @JsonProperty("medicine_id")
    String medicineId;

    @NotBlank(message = "Medicine name is required")
    @JsonProperty("name")
    String name;

    @Positive(message = "Quantity must be positive")
    @JsonProperty("quantity")
    int quantity;
}
