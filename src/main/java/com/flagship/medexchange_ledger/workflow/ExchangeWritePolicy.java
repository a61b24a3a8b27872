package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.error.PolicyViolationException;
import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import com.flagship.medexchange_ledger.security.CallerRole;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PostUpdate;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Checks every exchange write at flush time, independent of the service that
 * made it. Without a caller (consumers, schedulers) the actor checks are
 * skipped but the transition table and immutable fields still hold.
 */
@Slf4j
public class ExchangeWritePolicy {

    @PostLoad
    @PostPersist
    @PostUpdate
    void remember(ExchangeEntity exchange) {
        exchange.rememberPersistedState();
    }

    @PrePersist
    void beforeInsert(ExchangeEntity exchange) {
        if (exchange.getStatus() != ExchangeStatus.DRAFT && exchange.getStatus() != ExchangeStatus.PENDING) {
            throw deny("An exchange starts as DRAFT or PENDING, not " + exchange.getStatus());
        }
        if (exchange.getLocation() == null || isBlank(exchange.getLocation().getCityId())) {
            throw deny("An exchange needs a city");
        }
        if (exchange.getResponderId() != null || exchange.getCourierId() != null) {
            throw deny("A new exchange has no responder or courier");
        }
        CallerIdentity caller = CallerContext.current().orElse(null);
        if (caller != null && !caller.isAdmin()
                && (caller.getRole() != CallerRole.PARTY || !caller.is(exchange.getRequesterId()))) {
            throw deny("Only a party can open an exchange, and only in its own name");
        }
    }

    @PreUpdate
    void beforeUpdate(ExchangeEntity exchange) {
        ExchangeState before = exchange.getPersistedState();
        if (before == null) {
            throw deny("Exchange " + exchange.getId() + " was not loaded before being written");
        }
        ExchangeState after = exchange.currentState();
        CallerIdentity caller = CallerContext.current().orElse(null);

        boolean ownerOrPlaceChanged = !Objects.equals(before.requesterId(), after.requesterId())
                || !Objects.equals(before.cityId(), after.cityId())
                || !Objects.equals(before.countryCode(), after.countryCode());
        if (ownerOrPlaceChanged
                && (caller == null || !caller.isAdmin() || isBlank(exchange.getOverrideJustification()))) {
            throw deny("Requester and location of exchange " + exchange.getId()
                    + " only change through an administrative override");
        }

        if (!Objects.equals(before.responderId(), after.responderId())) {
            boolean attachingOnAccept = before.responderId() == null
                    && before.status() == ExchangeStatus.PENDING
                    && after.status() == ExchangeStatus.ACCEPTED
                    && (caller == null || caller.is(after.responderId()));
            if (!attachingOnAccept) {
                throw deny("The responder is set once, by the party accepting the exchange");
            }
        }

        if (!Objects.equals(before.courierId(), after.courierId())) {
            boolean assigningCourier = before.courierId() == null
                    && before.status() == ExchangeStatus.ACCEPTED
                    && after.status() == ExchangeStatus.ACCEPTED
                    && (caller == null || (caller.isCourier() && caller.is(after.courierId())));
            if (!assigningCourier) {
                throw deny("The courier is set once, by the courier accepting the delivery");
            }
        }

        if (before.status() != after.status()) {
            if (!WorkflowRules.EXCHANGE.allows(before.status(), after.status())) {
                throw deny(String.format("Exchange cannot move from %s to %s", before.status(), after.status()));
            }
            if (caller != null && !WorkflowRules.EXCHANGE.permits(
                    before.status(), after.status(), WorkflowRules.relationsTo(caller, before))) {
                throw deny(String.format("%s may not move exchange %s from %s to %s",
                        caller.getUserId(), exchange.getId(), before.status(), after.status()));
            }
        }
    }

    private static PolicyViolationException deny(String message) {
        log.warn("Exchange write rejected: {}", message);
        return new PolicyViolationException(message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
