package com.feedrelay.webhook;

/**
 * The callback could not be completed at the transport level: connection refused, DNS failure,
 * or no response within the endpoint timeout (message {@code "Timeout"}). Caught by the
 * dispatcher and recorded as a failed attempt; never propagated to callers of {@code trigger}.
 */
public class WebhookTransportException extends Exception {

    public WebhookTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
