package com.feedrelay.webhook;

import com.feedrelay.domain.enums.WebhookEventType;
import com.feedrelay.domain.model.WebhookEndpoint;
import java.security.SecureRandom;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/**
 * Process-local store of webhook endpoints.
 *
 * <p>Stored endpoints are replaced, never mutated in place: {@link #update} swaps in a modified
 * copy, so a worker holding an endpoint reference sees a consistent configuration for the whole
 * attempt.
 */
@Component
public class WebhookEndpointRegistry {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private final Map<String, WebhookEndpoint> endpoints = new ConcurrentHashMap<>();

    public WebhookEndpoint save(WebhookEndpoint endpoint) {
        endpoints.put(endpoint.getId(), endpoint);
        return endpoint;
    }

    public Optional<WebhookEndpoint> find(String endpointId) {
        return Optional.ofNullable(endpoints.get(endpointId));
    }

    /** Applies {@code change} to a copy of the endpoint and stores the copy. */
    public Optional<WebhookEndpoint> update(String endpointId, UnaryOperator<WebhookEndpoint> change) {
        return Optional.ofNullable(
                endpoints.computeIfPresent(endpointId, (id, current) -> change.apply(current.toBuilder().build())));
    }

    public boolean remove(String endpointId) {
        return endpoints.remove(endpointId) != null;
    }

    /** Endpoints owned by {@code ownerId}, or every endpoint when it is null, oldest first. */
    public List<WebhookEndpoint> findAll(String ownerId) {
        return endpoints.values().stream()
                .filter(endpoint -> ownerId == null || ownerId.equals(endpoint.getOwnerId()))
                .sorted(Comparator.comparing(WebhookEndpoint::getCreatedAt).thenComparing(WebhookEndpoint::getId))
                .toList();
    }

    /**
     * Enabled, unbound endpoints subscribed to {@code event}. With an owner scope, only endpoints
     * owned by that client or by nobody.
     */
    public List<WebhookEndpoint> findTriggerTargets(WebhookEventType event, String ownerScope) {
        return endpoints.values().stream()
                .filter(WebhookEndpoint::isEnabled)
                .filter(endpoint -> !endpoint.isBoundToSubscription())
                .filter(endpoint -> endpoint.isSubscribedTo(event))
                .filter(endpoint -> ownerScope == null
                        || endpoint.getOwnerId() == null
                        || ownerScope.equals(endpoint.getOwnerId()))
                .toList();
    }

    public int size() {
        return endpoints.size();
    }

    public int activeCount() {
        return (int) endpoints.values().stream().filter(WebhookEndpoint::isEnabled).count();
    }

    /** {@code wh_} followed by 16 hex characters. */
    public String generateId() {
        return "wh_" + randomHex(8);
    }

    /** 64 hex characters. */
    public String generateSecret() {
        return randomHex(32);
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return HEX.formatHex(buffer);
    }
}
