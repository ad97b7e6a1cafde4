package com.feedrelay.unit.push;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.feedrelay.push.ConnectionRegistry;
import com.feedrelay.push.PushConnection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

class ConnectionRegistryTest {

    private final ConnectionRegistry connectionRegistry = new ConnectionRegistry();

    private PushConnection connection(String id, String clientId) {
        return new PushConnection(id, clientId, mock(WebSocketSession.class));
    }

    @Test
    @DisplayName("Tracks several connections per client")
    void severalConnectionsPerClient() {
        connectionRegistry.register(connection("c1", "client-a"));
        connectionRegistry.register(connection("c2", "client-a"));
        connectionRegistry.register(connection("c3", "client-b"));

        assertThat(connectionRegistry.activeCount()).isEqualTo(3);
        assertThat(connectionRegistry.connectedClients()).isEqualTo(2);
        assertThat(connectionRegistry.connectionsOf("client-a"))
                .extracting(PushConnection::getId)
                .containsExactlyInAnyOrder("c1", "c2");
    }

    @Test
    @DisplayName("Removing is idempotent and drops the client once its last connection is gone")
    void removeIsIdempotent() {
        connectionRegistry.register(connection("c1", "client-a"));

        assertThat(connectionRegistry.remove("c1")).isPresent();
        assertThat(connectionRegistry.remove("c1")).isEmpty();
        assertThat(connectionRegistry.activeCount()).isZero();
        assertThat(connectionRegistry.connectedClients()).isZero();
        assertThat(connectionRegistry.connectionsOf("client-a")).isEmpty();
        assertThat(connectionRegistry.find("c1")).isEmpty();
    }
}
