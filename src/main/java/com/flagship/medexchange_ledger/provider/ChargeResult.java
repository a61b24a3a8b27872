package com.flagship.medexchange_ledger.provider;

public record ChargeResult(String providerReference, String paymentLink) {
}
