package com.flagship.medexchange_ledger.webhook;

import com.flagship.medexchange_ledger.provider.ProviderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the {@code verif-hash} header against the configured webhook secret.
 *
 * The comparison is constant-time. An unset secret rejects everything.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSignatureVerifier {

    public static final String SIGNATURE_HEADER = "verif-hash";

    private final ProviderProperties properties;

    public boolean isAuthentic(String signature) {
        String secret = properties.getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            log.error("Webhook secret is not configured; rejecting callback");
            return false;
        }
        if (signature == null || signature.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                signature.getBytes(StandardCharsets.UTF_8),
                secret.getBytes(StandardCharsets.UTF_8));
    }
}
