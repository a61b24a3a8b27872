package com.flagship.medexchange_ledger.security;

import com.flagship.medexchange_ledger.error.PermissionDeniedException;
import com.flagship.medexchange_ledger.error.UnauthenticatedException;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for the caller of the current request.
 *
 * Populated by {@link CallerIdentityFilter} for HTTP requests. Background work
 * (schedulers, Kafka consumers) runs without a caller, which the persistence
 * write policy treats as the system actor.
 */
public final class CallerContext {

    public static final String CALLER_ID_HEADER = "X-Caller-Id";
    public static final String CALLER_ROLE_HEADER = "X-Caller-Role";
    public static final String CALLER_CITY_HEADER = "X-Caller-City";
    public static final String CALLER_ID_MDC_KEY = "callerId";

    private static final ThreadLocal<CallerIdentity> current = new ThreadLocal<>();

    private CallerContext() {
    }

    public static void set(CallerIdentity identity) {
        current.set(identity);
    }

    public static void clear() {
        current.remove();
    }

    public static Optional<CallerIdentity> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * @throws UnauthenticatedException when the request carries no identity
     */
    public static CallerIdentity require() {
        CallerIdentity identity = current.get();
        if (identity == null) {
            throw new UnauthenticatedException("Authentication required");
        }
        return identity;
    }

    /**
     * @throws PermissionDeniedException unless the caller is an administrator
     */
    public static CallerIdentity requireAdmin() {
        CallerIdentity identity = require();
        if (!identity.isAdmin()) {
            throw new PermissionDeniedException("Administrator role required");
        }
        return identity;
    }

    public static CallerIdentity requireCourier() {
        CallerIdentity identity = require();
        if (!identity.isCourier()) {
            throw new PermissionDeniedException("Courier role required");
        }
        return identity;
    }

    /**
     * Runs {@code work} as the given caller and restores the previous one.
     * Used by tests and by internal callers that act on behalf of a user.
     */
    public static <T> T runAs(CallerIdentity identity, Supplier<T> work) {
        CallerIdentity previous = current.get();
        current.set(identity);
        try {
            return work.get();
        } finally {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
    }
}
