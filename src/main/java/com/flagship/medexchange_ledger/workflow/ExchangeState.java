package com.flagship.medexchange_ledger.workflow;

/**
 * The authorization-relevant fields of an exchange at one point in time.
 */
public record ExchangeState(String requesterId,
                            String responderId,
                            String courierId,
                            ExchangeStatus status,
                            String cityId,
                            String countryCode) {

    static ExchangeState of(ExchangeEntity exchange) {
        return new ExchangeState(
                exchange.getRequesterId(),
                exchange.getResponderId(),
                exchange.getCourierId(),
                exchange.getStatus(),
                exchange.getLocation().getCityId(),
                exchange.getLocation().getCountryCode());
    }
}
