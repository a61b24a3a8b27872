package com.flagship.medexchange_ledger.provider;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Collection request. {@code amount} is a display amount, as the provider expects.
 * {@code network} is set for mobile money and null for hosted card checkout.
 */
@Value
@Builder
public class ChargeRequest {
    String txRef;
    BigDecimal amount;
    String currency;
    String phoneNumber;
    String network;
    String customerId;
    String customerEmail;
    String redirectUrl;
    String title;
    Map<String, String> meta;
}
