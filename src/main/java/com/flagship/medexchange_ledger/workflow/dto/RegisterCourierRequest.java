package com.flagship.medexchange_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.Set;

/**
 * Creates or replaces a courier's service area. {@code active} defaults to true.
 */
@Value
public class RegisterCourierRequest {

    @NotBlank(message = "country_code is required")
    @JsonProperty("country_code")
    String countryCode;

    @NotEmpty(message = "at least one city is required")
    @JsonProperty("city_ids")
    Set<@NotBlank String> cityIds;

    @JsonProperty("active")
    Boolean active;
}
