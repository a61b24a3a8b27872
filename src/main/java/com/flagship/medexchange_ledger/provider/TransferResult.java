package com.flagship.medexchange_ledger.provider;

public record TransferResult(String providerTransferId, String status) {
}
