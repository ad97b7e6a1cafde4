package com.feedrelay.webhook;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * HMAC-SHA256 signing of outbound webhook bodies.
 *
 * <p>The signature covers the exact bytes sent as the request body. Receivers verify by
 * recomputing the HMAC over the raw body with their copy of the secret and comparing it with the
 * {@value #SIGNATURE_HEADER} header (after the {@code sha256=} prefix).
 */
@Component
public class WebhookSigner {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String SIGNATURE_PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    /** Lowercase hex HMAC-SHA256 of {@code payload} keyed by {@code secret}. */
    public String sign(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] hash = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate webhook signature", e);
        }
    }

    /** Header value in the {@code sha256=<hex>} form. */
    public String signatureHeader(String payload, String secret) {
        return SIGNATURE_PREFIX + sign(payload, secret);
    }
}
