package com.flagship.medexchange_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.util.List;

/**
 * A new exchange. With {@code submit} it is published to the city right away,
 * otherwise it stays a draft.
 */
@Value
public class CreateExchangeRequest {

    @NotBlank(message = "City is required")
    @JsonProperty("city_id")
    String cityId;

    @NotBlank(message = "Country is required")
    @Pattern(regexp = "^[A-Z]{2}$", message = "Country must be a 2-letter ISO code")
    @JsonProperty("country_code")
    String countryCode;

    @JsonProperty("notes")
    String notes;

    @NotEmpty(message = "At least one requested medicine is required")
    @JsonProperty("requested_items")
    List<@Valid ExchangeItemRequest> requestedItems;

    @JsonProperty("offered_items")
    List<@Valid ExchangeItemRequest> offeredItems;

    @JsonProperty("submit")
    boolean submit;
}
