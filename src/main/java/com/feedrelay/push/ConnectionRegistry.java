package com.feedrelay.push;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Open push connections, by connection id and by client id. A client may hold several
 * connections at once.
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, PushConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> connectionsByClient = new ConcurrentHashMap<>();

    public void register(PushConnection connection) {
        connections.put(connection.getId(), connection);
        connectionsByClient
                .computeIfAbsent(connection.getClientId(), clientId -> ConcurrentHashMap.newKeySet())
                .add(connection.getId());
        log.info("Push connection {} opened for client {} ({} active)", connection.getId(), connection.getClientId(),
                connections.size());
    }

    public Optional<PushConnection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    /** Removes the connection; calling it again for the same id is a no-op. */
    public Optional<PushConnection> remove(String connectionId) {
        PushConnection removed = connections.remove(connectionId);
        if (removed == null) {
            return Optional.empty();
        }
        connectionsByClient.computeIfPresent(removed.getClientId(), (clientId, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
        log.info("Push connection {} closed for client {} ({} active)", connectionId, removed.getClientId(),
                connections.size());
        return Optional.of(removed);
    }

    public List<PushConnection> connectionsOf(String clientId) {
        Set<String> ids = connectionsByClient.getOrDefault(clientId, Set.of());
        return ids.stream().map(connections::get).filter(connection -> connection != null).toList();
    }

    public int activeCount() {
        return connections.size();
    }

    public int connectedClients() {
        return connectionsByClient.size();
    }
}
