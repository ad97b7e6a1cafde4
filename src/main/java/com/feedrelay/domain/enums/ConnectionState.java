package com.feedrelay.domain.enums;

/**
 * Lifecycle of a push connection. Armed subscription ids are tracked per connection while OPEN.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
