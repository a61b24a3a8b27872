package com.flagship.medexchange_ledger.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.medexchange_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flutterwave v3 REST client.
 *
 * Every response is checked for {@code "status": "success"}; anything else,
 * including HTTP errors and timeouts, surfaces as {@link ProviderException}.
 */
@Component
@Slf4j
public class FlutterwaveClient implements PaymentProviderClient {

    private final RestTemplate restTemplate;
    private final ProviderProperties properties;
    private final LedgerMetrics metrics;

    public FlutterwaveClient(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                             ProviderProperties properties,
                             LedgerMetrics metrics) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return properties.getName();
    }

    @Override
    public VerifiedTransaction verifyTransaction(String providerTxId) {
        JsonNode data = call("verify", HttpMethod.GET, "/transactions/" + providerTxId + "/verify", null);
        return new VerifiedTransaction(
            data.path("id").asText(providerTxId),
            data.path("tx_ref").asText(null),
            data.path("status").asText(null),
            data.path("amount").decimalValue(),
            data.path("currency").asText(null)
        );
    }

    @Override
    public ChargeResult chargeMobileMoney(ChargeRequest request) {
        String chargeType = chargeTypeFor(request.getCurrency());

        Map<String, Object> body = baseChargeBody(request);
        body.put("phone_number", request.getPhoneNumber());
        body.put("network", request.getNetwork());
        String country = properties.getCurrencyCountries().get(request.getCurrency());
        if (country != null) {
            body.put("country", country);
        }

        JsonNode response = callRaw("charge", HttpMethod.POST, "/charges?type=" + chargeType, body);
        JsonNode data = response.path("data");
        String link = response.path("meta").path("authorization").path("redirect").asText(null);
        return new ChargeResult(data.path("flw_ref").asText(null), link);
    }

    @Override
    public ChargeResult createPaymentLink(ChargeRequest request) {
        Map<String, Object> body = baseChargeBody(request);
        body.put("customizations", Map.of("title", request.getTitle() != null ? request.getTitle() : "NowasteMed"));

        JsonNode data = call("payment_link", HttpMethod.POST, "/payments", body);
        return new ChargeResult(null, data.path("link").asText(null));
    }

    @Override
    public TransferResult initiateTransfer(TransferRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reference", request.getReference());
        body.put("amount", request.getAmount());
        body.put("currency", request.getCurrency());
        body.put("account_number", request.getAccountNumber());
        body.put("account_bank", request.getBankCode());
        body.put("beneficiary_name", request.getBeneficiaryName());
        body.put("narration", request.getNarration());
        if (request.getMeta() != null) {
            body.put("meta", request.getMeta());
        }

        JsonNode data = call("transfer", HttpMethod.POST, "/transfers", body);
        return new TransferResult(data.path("id").asText(null), data.path("status").asText(null));
    }

    private Map<String, Object> baseChargeBody(ChargeRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tx_ref", request.getTxRef());
        body.put("amount", request.getAmount());
        body.put("currency", request.getCurrency());
        body.put("redirect_url", request.getRedirectUrl());
        body.put("customer", Map.of(
            "email", request.getCustomerEmail() != null ? request.getCustomerEmail() : "",
            "name", request.getCustomerId() != null ? request.getCustomerId() : ""
        ));
        if (request.getMeta() != null) {
            body.put("meta", request.getMeta());
        }
        return body;
    }

    /**
     * Mobile-money rails differ per market.
     */
    private String chargeTypeFor(String currency) {
        return switch (currency) {
            case "XOF", "XAF", "GNF" -> "mobile_money_franco";
            case "GHS" -> "mobile_money_ghana";
            case "UGX" -> "mobile_money_uganda";
            case "RWF" -> "mobile_money_rwanda";
            case "TZS" -> "mobile_money_tanzania";
            case "KES" -> "mpesa";
            case "NGN" -> "bank_transfer";
            default -> throw new ProviderException("Mobile money is not available for " + currency);
        };
    }

    private JsonNode call(String operation, HttpMethod method, String path, Object body) {
        return callRaw(operation, method, path, body).path("data");
    }

    private JsonNode callRaw(String operation, HttpMethod method, String path, Object body) {
        long start = System.currentTimeMillis();
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getSecretKey());
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                properties.getBaseUrl() + path, method, new HttpEntity<>(body, headers), JsonNode.class);
            JsonNode payload = response.getBody();

            if (payload == null || !"success".equalsIgnoreCase(payload.path("status").asText())) {
                String message = payload != null ? payload.path("message").asText("rejected") : "empty response";
                log.warn("Provider {} call rejected: {}", operation, message);
                throw new ProviderException("Provider rejected " + operation + ": " + message);
            }
            return payload;

        } catch (RestClientException e) {
            log.error("Provider {} call failed: {}", operation, e.getMessage());
            throw new ProviderException("Provider " + operation + " call failed", e);
        } finally {
            metrics.recordProviderLatency(operation, System.currentTimeMillis() - start);
        }
    }
}
