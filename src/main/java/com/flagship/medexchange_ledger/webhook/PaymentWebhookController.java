package com.flagship.medexchange_ledger.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Payment provider callback endpoint.
 *
 * 401 for a missing or wrong signature, 400 for a body we cannot read,
 * otherwise 200 regardless of the processing outcome. A non-200 would make
 * the provider retry, and internal failures are reconciled by operators instead.
 */
@RestController
@RequestMapping("/api/webhooks/payment-provider")
@RequiredArgsConstructor
@Slf4j
public class PaymentWebhookController {

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentNotificationProcessor processor;
    private final ObjectMapper objectMapper;

    @PostMapping
    public ResponseEntity<Map<String, String>> receive(
            @RequestHeader(value = WebhookSignatureVerifier.SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) String body) {

        if (!signatureVerifier.isAuthentic(signature)) {
            log.warn("Rejected provider callback with invalid signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Invalid signature"));
        }

        PaymentNotification notification = parse(body);
        if (notification == null || !notification.isWellFormed()) {
            log.warn("Rejected malformed provider callback");
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid payload"));
        }

        log.info("Received provider callback: event={}, providerTxId={}, reference={}, status={}",
                notification.getEvent(), notification.getData().getId(),
                notification.ourReference(), notification.getData().getStatus());

        NotificationOutcome outcome = processor.process(notification);
        return ResponseEntity.ok(Map.of("status", outcome.name()));
    }

    private PaymentNotification parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, PaymentNotification.class);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable callback body: {}", e.getOriginalMessage());
            return null;
        }
    }
}
