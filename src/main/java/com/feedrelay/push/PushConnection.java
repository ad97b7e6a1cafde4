package com.feedrelay.push;

import com.feedrelay.domain.enums.ConnectionState;
import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * One open push channel: the authenticated client, the subscription ids it has armed and the
 * handle of its delivery task.
 *
 * <p>The session is expected to be a
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}, since the
 * delivery task and the inbound handler send on it from different threads.
 */
public class PushConnection {

    private final String id;
    private final String clientId;
    private final WebSocketSession session;
    private final Set<Long> armedSubscriptions = ConcurrentHashMap.newKeySet();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private volatile ScheduledFuture<?> deliveryTask;

    public PushConnection(String id, String clientId, WebSocketSession session) {
        this.id = id;
        this.clientId = clientId;
        this.session = session;
    }

    public String getId() {
        return id;
    }

    public String getClientId() {
        return clientId;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public void setState(ConnectionState newState) {
        state.set(newState);
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN && session.isOpen();
    }

    /** @return false if the id was already armed */
    public boolean arm(Long subscriptionId) {
        return armedSubscriptions.add(subscriptionId);
    }

    public boolean disarm(Long subscriptionId) {
        return armedSubscriptions.remove(subscriptionId);
    }

    /** Snapshot of the armed ids. */
    public Set<Long> armedSubscriptions() {
        return Set.copyOf(armedSubscriptions);
    }

    public void send(String json) throws IOException {
        session.sendMessage(new TextMessage(json));
    }

    public ScheduledFuture<?> getDeliveryTask() {
        return deliveryTask;
    }

    public void setDeliveryTask(ScheduledFuture<?> deliveryTask) {
        this.deliveryTask = deliveryTask;
    }
}
