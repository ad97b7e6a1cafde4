package com.feedrelay.domain.enums;

/**
 * How a subscription's matching records reach its owner.
 */
public enum DeliveryMode {
    /** Client calls GET /api/subscriptions/{id}/data when it chooses. */
    PULL,
    /** Records are forwarded over an open /ws/subscribe channel once the id is armed. */
    PUSH,
    /** Records are POSTed to the subscription's callback url through the webhook engine. */
    CALLBACK
}
