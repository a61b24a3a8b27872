package com.flagship.medexchange_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Administrative correction. Unset fields are left unchanged; city and
 * country change together.
 */
@Value
public class ExchangeOverrideRequest {

    @JsonProperty("requester_id")
    String requesterId;

    @JsonProperty("city_id")
    String cityId;

    @JsonProperty("country_code")
    String countryCode;

    @NotBlank(message = "A justification is required")
    @JsonProperty("justification")
    String justification;
}
