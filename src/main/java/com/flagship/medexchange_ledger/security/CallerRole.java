package com.flagship.medexchange_ledger.security;

public enum CallerRole {
    PARTY,
    COURIER,
    ADMIN
}
