package com.feedrelay.unit.webhook;

import static org.assertj.core.api.Assertions.assertThat;

import com.feedrelay.webhook.WebhookSigner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WebhookSignerTest {

    private final WebhookSigner webhookSigner = new WebhookSigner();

    @Test
    @DisplayName("Matches the well-known HMAC-SHA256 value for key/\"quick brown fox\"")
    void knownVector() {
        String signature = webhookSigner.sign("The quick brown fox jumps over the lazy dog", "key");

        assertThat(signature).isEqualTo("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8");
    }

    @Test
    @DisplayName("Same payload and secret always give the same signature")
    void deterministic() {
        String payload = "{\"id\":\"d-1\",\"event\":\"data.created\",\"data\":{\"id\":3}}";

        assertThat(webhookSigner.sign(payload, "s3cret")).isEqualTo(webhookSigner.sign(payload, "s3cret"));
    }

    @Test
    @DisplayName("Changing one byte of the payload or the secret changes the signature")
    void sensitiveToSingleByteChanges() {
        String payload = "{\"id\":\"d-1\",\"event\":\"data.created\",\"data\":{\"id\":3}}";
        String tamperedPayload = payload.replace("\"id\":3", "\"id\":4");
        String base = webhookSigner.sign(payload, "s3cret");

        assertThat(webhookSigner.sign(tamperedPayload, "s3cret")).isNotEqualTo(base);
        assertThat(webhookSigner.sign(payload, "s3creT")).isNotEqualTo(base);
    }

    @Test
    @DisplayName("Header value is the hex signature with a sha256= prefix")
    void headerFormat() {
        String header = webhookSigner.signatureHeader("{}", "secret");

        assertThat(header).startsWith("sha256=").hasSize("sha256=".length() + 64);
        assertThat(header.substring(7)).matches("[0-9a-f]{64}");
    }
}
