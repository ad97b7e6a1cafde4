package com.feedrelay.domain.model;

import com.feedrelay.domain.enums.WebhookEventType;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A registered HTTP callback target.
 *
 * <p>Endpoints bound to a subscription ({@code subscriptionId != null}) only receive deliveries
 * routed to them explicitly; generic {@code trigger} fan-out skips them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEndpoint {

    private String id;
    private String ownerId;
    private String url;
    private String secret;
    private Set<WebhookEventType> events;
    private boolean enabled;
    private Map<String, String> headers;

    /** Total attempts allowed per delivery, including the first. */
    private int retryCount;

    private Duration timeout;
    private Long subscriptionId;
    private LocalDateTime createdAt;

    public boolean isSubscribedTo(WebhookEventType eventType) {
        return events != null && events.contains(eventType);
    }

    public boolean isBoundToSubscription() {
        return subscriptionId != null;
    }
}
