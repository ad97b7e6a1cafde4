package com.feedrelay.webhook;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the webhook dispatch engine.
 *
 * <pre>
 * feedrelay.webhook.workers=3
 * feedrelay.webhook.default-retry-count=3
 * feedrelay.webhook.default-timeout=30s
 * feedrelay.webhook.history-max-size=1000
 * feedrelay.webhook.history-retention=24h
 * feedrelay.webhook.backoff-base=1s
 * </pre>
 *
 * <p>The retry delay after attempt {@code n} is {@code backoffBase * 2^n}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "feedrelay.webhook")
public class WebhookProperties {

    private int workers = 3;
    private int defaultRetryCount = 3;
    private Duration defaultTimeout = Duration.ofSeconds(30);
    private int historyMaxSize = 1000;
    private Duration historyRetention = Duration.ofHours(24);
    private Duration backoffBase = Duration.ofSeconds(1);

    /** Upper bound for stored response bodies. */
    private int responseBodyMaxLength = 1000;
}
