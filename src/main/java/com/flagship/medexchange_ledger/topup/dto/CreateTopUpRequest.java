package com.flagship.medexchange_ledger.topup.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Wallet top-up request. {@code amount} is in display units of {@code currency}.
 */
@Value
public class CreateTopUpRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotBlank(message = "Payment method is required")
    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("phone_number")
    String phoneNumber;

    @JsonProperty("mobile_provider_id")
    String mobileProviderId;

    @JsonProperty("redirect_url")
    String redirectUrl;
}
