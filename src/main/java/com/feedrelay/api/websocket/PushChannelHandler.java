package com.feedrelay.api.websocket;

import com.feedrelay.auth.ClientAuthService;
import com.feedrelay.domain.enums.ConnectionState;
import com.feedrelay.push.ConnectionRegistry;
import com.feedrelay.push.PushConnection;
import com.feedrelay.push.PushDeliveryLoop;
import com.feedrelay.subscription.SubscriptionService;
import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Handler for the {@code /ws/subscribe} push channel.
 *
 * <p>The client authenticates with {@code client_key} and {@code client_secret} query
 * parameters; a failed check closes the socket with code 4001. Once open, the client arms
 * subscriptions it owns with {@code subscribe} frames, and the connection's delivery loop
 * forwards their new records as {@code data} frames until the id is disarmed or the socket
 * closes.
 *
 * <p>Control frames:
 * <pre>
 * {"action": "subscribe", "subscription_id": 7}   -> {"type": "subscribed", "subscription_id": 7}
 * {"action": "unsubscribe", "subscription_id": 7} -> {"type": "unsubscribed", "subscription_id": 7}
 * {"action": "ping"}                              -> {"type": "pong"}
 * </pre>
 * Problems with a frame are answered with an {@code error} frame; the connection stays open.
 */
@Component
public class PushChannelHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(PushChannelHandler.class);

    public static final CloseStatus AUTHENTICATION_FAILED = new CloseStatus(4001, "Authentication failed");

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final ClientAuthService clientAuthService;
    private final SubscriptionService subscriptionService;
    private final ConnectionRegistry connectionRegistry;
    private final PushDeliveryLoop pushDeliveryLoop;
    private final ObjectMapper objectMapper;

    public PushChannelHandler(
            ClientAuthService clientAuthService,
            SubscriptionService subscriptionService,
            ConnectionRegistry connectionRegistry,
            PushDeliveryLoop pushDeliveryLoop,
            ObjectMapper objectMapper) {
        this.clientAuthService = clientAuthService;
        this.subscriptionService = subscriptionService;
        this.connectionRegistry = connectionRegistry;
        this.pushDeliveryLoop = pushDeliveryLoop;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Optional<String> clientId = authenticate(session.getUri());
        if (clientId.isEmpty()) {
            log.warn("Push connection {} rejected: authentication failed", session.getId());
            session.close(AUTHENTICATION_FAILED);
            return;
        }

        WebSocketSession concurrentSession =
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        PushConnection connection = new PushConnection(session.getId(), clientId.get(), concurrentSession);
        connection.setState(ConnectionState.OPEN);
        connectionRegistry.register(connection);

        send(connection, PushFrame.connected(clientId.get()));
        pushDeliveryLoop.start(connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Optional<PushConnection> found = connectionRegistry.find(session.getId());
        if (found.isEmpty()) {
            return;
        }
        PushConnection connection = found.get();

        PushControlMessage control;
        try {
            control = objectMapper.readValue(message.getPayload(), PushControlMessage.class);
        } catch (JacksonException e) {
            log.debug("Invalid frame on connection {}: {}", connection.getId(), e.getOriginalMessage());
            send(connection, PushFrame.error("Invalid JSON message"));
            return;
        }
        if (control == null) {
            send(connection, PushFrame.error("Invalid JSON message"));
            return;
        }

        String action = control.getAction();
        if ("subscribe".equals(action)) {
            handleSubscribe(connection, control.getSubscriptionId());
        } else if ("unsubscribe".equals(action)) {
            handleUnsubscribe(connection, control.getSubscriptionId());
        } else if ("ping".equals(action)) {
            send(connection, PushFrame.pong());
        } else {
            send(connection, PushFrame.error("Unknown action: " + action));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on push connection {}: {}", session.getId(), exception.getMessage());
        cleanup(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Push connection {} closed with {}", session.getId(), status);
        cleanup(session.getId());
    }

    private void handleSubscribe(PushConnection connection, Long subscriptionId) {
        if (subscriptionId == null) {
            send(connection, PushFrame.error("subscription_id is required"));
            return;
        }
        // Foreign subscriptions are reported as missing so ids of other clients are not disclosed.
        if (!subscriptionService.isOwnedBy(subscriptionId, connection.getClientId())) {
            send(connection, PushFrame.error("Subscription " + subscriptionId + " not found"));
            return;
        }
        connection.arm(subscriptionId);
        log.debug("Connection {} armed subscription {}", connection.getId(), subscriptionId);
        send(connection, PushFrame.subscribed(subscriptionId));
    }

    private void handleUnsubscribe(PushConnection connection, Long subscriptionId) {
        if (subscriptionId == null) {
            send(connection, PushFrame.error("subscription_id is required"));
            return;
        }
        connection.disarm(subscriptionId);
        send(connection, PushFrame.unsubscribed(subscriptionId));
    }

    private void cleanup(String connectionId) {
        connectionRegistry.remove(connectionId).ifPresent(connection -> {
            connection.setState(ConnectionState.CLOSING);
            pushDeliveryLoop.stop(connection);
            connection.setState(ConnectionState.CLOSED);
        });
    }

    private Optional<String> authenticate(URI uri) {
        if (uri == null) {
            return Optional.empty();
        }
        MultiValueMap<String, String> params =
                UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        return clientAuthService.resolveClient(
                decode(params.getFirst("client_key")), decode(params.getFirst("client_secret")));
    }

    private void send(PushConnection connection, PushFrame frame) {
        try {
            connection.send(objectMapper.writeValueAsString(frame));
        } catch (IOException e) {
            log.warn("Failed to send {} frame on connection {}: {}", frame.getType(), connection.getId(),
                    e.getMessage());
        }
    }

    private static String decode(String value) {
        return value != null ? URLDecoder.decode(value, StandardCharsets.UTF_8) : null;
    }
}
