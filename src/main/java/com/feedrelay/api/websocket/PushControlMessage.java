package com.feedrelay.api.websocket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound control frame: {@code {"action": "subscribe", "subscription_id": 7}}.
 * Actions are subscribe, unsubscribe and ping.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushControlMessage {

    private String action;

    @JsonProperty("subscription_id")
    private Long subscriptionId;
}
