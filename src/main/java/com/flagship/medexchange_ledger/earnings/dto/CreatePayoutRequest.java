package com.flagship.medexchange_ledger.earnings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Courier withdrawal. {@code amount} is in display units and is what leaves
 * the available balance; the provider transfers it minus the payout fee.
 */
@Value
public class CreatePayoutRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotBlank(message = "Destination type is required")
    @JsonProperty("destination_type")
    String destinationType;

    @NotBlank(message = "Account number is required")
    @JsonProperty("account_number")
    String accountNumber;

    // Mobile money: the marketplace provider id. Bank transfer: the bank code.
    @JsonProperty("provider_id")
    String providerId;

    @JsonProperty("bank_code")
    String bankCode;

    @JsonProperty("account_name")
    String accountName;
}
