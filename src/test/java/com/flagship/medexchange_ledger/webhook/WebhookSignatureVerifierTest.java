package com.flagship.medexchange_ledger.webhook;

import com.flagship.medexchange_ledger.provider.ProviderProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignatureVerifierTest {

    @Test
    void acceptsOnlyTheConfiguredSecret() {
        WebhookSignatureVerifier verifier = verifierWithSecret("s3cret-hash");

        assertTrue(verifier.isAuthentic("s3cret-hash"));
        assertFalse(verifier.isAuthentic("s3cret-hasH"));
        assertFalse(verifier.isAuthentic("s3cret-hash "));
        assertFalse(verifier.isAuthentic(""));
        assertFalse(verifier.isAuthentic(null));
    }

    @Test
    void unconfiguredSecretRejectsEverything() {
        WebhookSignatureVerifier verifier = verifierWithSecret("");

        assertFalse(verifier.isAuthentic(""));
        assertFalse(verifier.isAuthentic("anything"));
    }

    private static WebhookSignatureVerifier verifierWithSecret(String secret) {
        ProviderProperties properties = new ProviderProperties();
        properties.setWebhookSecret(secret);
        return new WebhookSignatureVerifier(properties);
    }
}
