package com.flagship.medexchange_ledger.security;

import lombok.Value;

/**
 * Authenticated caller as asserted by the gateway.
 * {@code cityId} is the party's registered city; it may be null for administrators.
 */
@Value
public class CallerIdentity {
    String userId;
    CallerRole role;
    String cityId;

    public static CallerIdentity of(String userId, CallerRole role, String cityId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Caller id cannot be blank");
        }
        return new CallerIdentity(userId, role, cityId);
    }

    public boolean isAdmin() {
        return role == CallerRole.ADMIN;
    }

    public boolean isCourier() {
        return role == CallerRole.COURIER;
    }

    public boolean is(String otherUserId) {
        return userId.equals(otherUserId);
    }
}
