package com.flagship.medexchange_ledger.ledger;

import com.flagship.medexchange_ledger.money.CurrencyCode;
import lombok.Value;

import java.time.Instant;

@Value
public class Wallet {
    String userId;
    long balance;
    CurrencyCode currency;
    Instant createdAt;
    Instant updatedAt;
}
