package com.feedrelay.api.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound frame on the /ws/subscribe channel.
 *
 * <p>Every frame carries a {@code type}: connected, subscribed, unsubscribed, pong, error or
 * data. Fields not used by a type are left out of the JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PushFrame {

    private String type;
    private String message;

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("subscription_id")
    private Long subscriptionId;

    private Object data;

    @JsonProperty("has_more")
    private Boolean hasMore;

    public static PushFrame connected(String clientId) {
        return PushFrame.builder()
                .type("connected")
                .message("Connected successfully")
                .clientId(clientId)
                .build();
    }

    public static PushFrame subscribed(Long subscriptionId) {
        return PushFrame.builder().type("subscribed").subscriptionId(subscriptionId).build();
    }

    public static PushFrame unsubscribed(Long subscriptionId) {
        return PushFrame.builder().type("unsubscribed").subscriptionId(subscriptionId).build();
    }

    public static PushFrame pong() {
        return PushFrame.builder().type("pong").build();
    }

    public static PushFrame error(String message) {
        return PushFrame.builder().type("error").message(message).build();
    }

    public static PushFrame data(Long subscriptionId, Object records, boolean hasMore) {
        return PushFrame.builder()
                .type("data")
                .subscriptionId(subscriptionId)
                .data(records)
                .hasMore(hasMore)
                .build();
    }
}
