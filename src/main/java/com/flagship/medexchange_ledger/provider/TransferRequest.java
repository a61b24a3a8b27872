package com.flagship.medexchange_ledger.provider;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Disbursement to a courier. {@code bankCode} doubles as the mobile network
 * code when {@code destinationType} is mobile money.
 */
@Value
@Builder
public class TransferRequest {
    String reference;
    BigDecimal amount;
    String currency;
    String accountNumber;
    String bankCode;
    String beneficiaryName;
    String narration;
    Map<String, String> meta;
}
