package com.feedrelay.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import com.feedrelay.exception.ValidationException;
import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of events a webhook endpoint can subscribe to. The wire name is what appears in
 * the {@code X-Webhook-Event} header and in the envelope's {@code event} field.
 */
@Getter
@RequiredArgsConstructor
public enum WebhookEventType {
    DATA_CREATED("data.created"),
    DATA_UPDATED("data.updated"),
    DATA_DELETED("data.deleted"),
    DATA_BATCH_CREATED("data.batch_created"),

    SUBSCRIPTION_CREATED("subscription.created"),
    SUBSCRIPTION_ACTIVATED("subscription.activated"),
    SUBSCRIPTION_DEACTIVATED("subscription.deactivated"),
    SUBSCRIPTION_DELETED("subscription.deleted"),

    CLIENT_CREATED("client.created"),
    CLIENT_ACTIVATED("client.activated"),
    CLIENT_DEACTIVATED("client.deactivated"),

    SYSTEM_ALERT("system.alert"),
    SYSTEM_BACKUP_COMPLETED("system.backup_completed"),
    DAILY_REPORT("system.daily_report"),

    STRATEGY_CREATED("strategy.created"),
    STRATEGY_UPDATED("strategy.updated");

    @JsonValue
    private final String wireName;

    /**
     * Resolves a wire name such as {@code "data.created"}.
     *
     * @throws ValidationException if the name is not part of the set
     */
    public static WebhookEventType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Invalid event type: " + wireName));
    }
}
