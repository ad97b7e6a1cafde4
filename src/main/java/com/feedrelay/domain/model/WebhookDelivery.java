package com.feedrelay.domain.model;

import com.feedrelay.domain.enums.DeliveryStatus;
import com.feedrelay.domain.enums.WebhookEventType;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One event on its way to one endpoint. The same instance is re-queued across retries;
 * the history stores a {@link #snapshot()} per attempt.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDelivery {

    private String id;
    private String endpointId;
    private WebhookEventType event;
    private Map<String, Object> payload;
    private DeliveryStatus status;
    private int attempts;
    private LocalDateTime lastAttemptAt;
    private Integer responseCode;
    private String responseBody;
    private String error;

    public WebhookDelivery snapshot() {
        return toBuilder().build();
    }
}
