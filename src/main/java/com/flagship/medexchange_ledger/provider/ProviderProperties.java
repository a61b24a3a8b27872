package com.flagship.medexchange_ledger.provider;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Payment provider account and boundary settings.
 *
 * <pre>
 * payment-provider:
 *   name: flutterwave
 *   base-url: https://api.flutterwave.com/v3
 *   secret-key: ...
 *   webhook-secret: ...          # expected value of the verif-hash header
 *   source-tag: nowastedmed      # meta.source on every charge we create
 *   supported-currencies: [XOF, NGN, GHS, GNF, KES, TZS, UGX, BWP]
 *   networks: { mtn_momo_xof: MTN, ... }
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "payment-provider")
public class ProviderProperties {

    private String name = "flutterwave";
    private String baseUrl = "https://api.flutterwave.com/v3";
    private String secretKey = "";
    private String webhookSecret = "";
    private String sourceTag = "nowastedmed";
    private String redirectUrl = "https://nowastedmed.web.app/payment-callback";
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 15000;
    private Set<String> supportedCurrencies = new LinkedHashSet<>();

    /**
     * Marketplace mobile-money provider id to the provider's network code.
     */
    private Map<String, String> networks = new HashMap<>();

    /**
     * Currency to the country code the provider wants on mobile-money charges.
     */
    private Map<String, String> currencyCountries = new HashMap<>();

    public boolean supportsCurrency(String currency) {
        return supportedCurrencies.contains(currency);
    }
}
