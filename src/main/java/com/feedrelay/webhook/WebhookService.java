package com.feedrelay.webhook;

import com.feedrelay.domain.enums.DeliveryStatus;
import com.feedrelay.domain.enums.WebhookEventType;
import com.feedrelay.domain.model.DeliveryStats;
import com.feedrelay.domain.model.WebhookDelivery;
import com.feedrelay.domain.model.WebhookEndpoint;
import com.feedrelay.exception.ForbiddenException;
import com.feedrelay.exception.ResourceNotFoundException;
import com.feedrelay.exception.ValidationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the webhook engine: endpoint management, event fan-out and statistics.
 *
 * <p>{@link #trigger} and {@link #deliverTo} only enqueue; the HTTP work happens on the
 * {@link WebhookDispatcher} workers and its failures never reach the caller.
 *
 * <p>Management calls carry the caller's client id. An endpoint can only be read or changed by
 * its owner.
 */
@Service
public class WebhookService {

    private static final Logger log = LoggerFactory.getLogger(WebhookService.class);

    private final WebhookEndpointRegistry webhookEndpointRegistry;
    private final DeliveryQueue deliveryQueue;
    private final DeliveryHistory deliveryHistory;
    private final WebhookDispatcher webhookDispatcher;
    private final WebhookProperties webhookProperties;

    public WebhookService(
            WebhookEndpointRegistry webhookEndpointRegistry,
            DeliveryQueue deliveryQueue,
            DeliveryHistory deliveryHistory,
            WebhookDispatcher webhookDispatcher,
            WebhookProperties webhookProperties) {
        this.webhookEndpointRegistry = webhookEndpointRegistry;
        this.deliveryQueue = deliveryQueue;
        this.deliveryHistory = deliveryHistory;
        this.webhookDispatcher = webhookDispatcher;
        this.webhookProperties = webhookProperties;
    }

    // ---- Registration ----

    /**
     * Registers an endpoint. Missing secret, retry count and timeout are filled with a generated
     * secret and the configured defaults. The returned endpoint carries the secret; it is not
     * exposed again afterwards.
     *
     * @throws ValidationException if the url is not an absolute http(s) url, no events are given,
     *     the retry count is negative or the timeout is not positive
     */
    public WebhookEndpoint register(WebhookEndpoint draft) {
        validateUrl(draft.getUrl());
        if (draft.getEvents() == null || draft.getEvents().isEmpty()) {
            throw new ValidationException("At least one event is required");
        }
        if (draft.getRetryCount() < 0) {
            throw new ValidationException("retryCount must not be negative", Map.of("retryCount", draft.getRetryCount()));
        }
        if (draft.getTimeout() != null && (draft.getTimeout().isNegative() || draft.getTimeout().isZero())) {
            throw new ValidationException("timeout must be positive");
        }

        WebhookEndpoint endpoint = draft.toBuilder()
                .id(webhookEndpointRegistry.generateId())
                .secret(isBlank(draft.getSecret()) ? webhookEndpointRegistry.generateSecret() : draft.getSecret())
                .events(EnumSet.copyOf(draft.getEvents()))
                .headers(draft.getHeaders() != null ? new HashMap<>(draft.getHeaders()) : new HashMap<>())
                .retryCount(draft.getRetryCount() > 0 ? draft.getRetryCount() : webhookProperties.getDefaultRetryCount())
                .timeout(draft.getTimeout() != null ? draft.getTimeout() : webhookProperties.getDefaultTimeout())
                .createdAt(LocalDateTime.now())
                .build();

        webhookEndpointRegistry.save(endpoint);
        log.info("Registered webhook {} -> {} for events {} (owner={})", endpoint.getId(), endpoint.getUrl(),
                endpoint.getEvents(), endpoint.getOwnerId());
        return endpoint;
    }

    public WebhookEndpoint get(String endpointId, String callerId) {
        return loadOwned(endpointId, callerId);
    }

    public List<WebhookEndpoint> list(String ownerId) {
        return webhookEndpointRegistry.findAll(ownerId);
    }

    /**
     * Partial update; null arguments leave the field unchanged.
     */
    public WebhookEndpoint update(
            String endpointId, String callerId, String url, Set<WebhookEventType> events, Boolean enabled) {
        loadOwned(endpointId, callerId);
        if (url != null) {
            validateUrl(url);
        }
        if (events != null && events.isEmpty()) {
            throw new ValidationException("At least one event is required");
        }
        WebhookEndpoint updated = webhookEndpointRegistry
                .update(endpointId, endpoint -> {
                    if (url != null) {
                        endpoint.setUrl(url);
                    }
                    if (events != null) {
                        endpoint.setEvents(EnumSet.copyOf(events));
                    }
                    if (enabled != null) {
                        endpoint.setEnabled(enabled);
                    }
                    return endpoint;
                })
                .orElseThrow(() -> ResourceNotFoundException.webhook(endpointId));
        log.info("Updated webhook {}", endpointId);
        return updated;
    }

    public WebhookEndpoint enable(String endpointId, String callerId) {
        return update(endpointId, callerId, null, null, true);
    }

    public WebhookEndpoint disable(String endpointId, String callerId) {
        return update(endpointId, callerId, null, null, false);
    }

    public void unregister(String endpointId, String callerId) {
        loadOwned(endpointId, callerId);
        webhookEndpointRegistry.remove(endpointId);
        log.info("Unregistered webhook {}", endpointId);
    }

    /** Removes an endpoint without an ownership check, for endpoints managed by the system. */
    public void unregisterInternal(String endpointId) {
        if (webhookEndpointRegistry.remove(endpointId)) {
            log.info("Unregistered webhook {}", endpointId);
        }
    }

    // ---- Fan-out ----

    /**
     * Enqueues one delivery of {@code event} for every enabled endpoint subscribed to it.
     * Endpoints bound to a subscription are skipped.
     *
     * @param ownerScope when not null, only endpoints owned by this client (or by nobody) receive
     *     the event
     * @return number of deliveries enqueued
     */
    public int trigger(WebhookEventType event, Map<String, Object> payload, String ownerScope) {
        List<WebhookEndpoint> targets = webhookEndpointRegistry.findTriggerTargets(event, ownerScope);
        for (WebhookEndpoint endpoint : targets) {
            deliveryQueue.enqueue(newDelivery(endpoint.getId(), event, payload));
        }
        if (!targets.isEmpty()) {
            log.debug("Triggered {} for {} webhooks", event.getWireName(), targets.size());
        }
        return targets.size();
    }

    public int trigger(WebhookEventType event, Map<String, Object> payload) {
        return trigger(event, payload, null);
    }

    /**
     * Enqueues a delivery to one endpoint regardless of its event set.
     *
     * @return the pending delivery
     */
    public WebhookDelivery deliverTo(String endpointId, WebhookEventType event, Map<String, Object> payload) {
        if (webhookEndpointRegistry.find(endpointId).isEmpty()) {
            throw ResourceNotFoundException.webhook(endpointId);
        }
        WebhookDelivery delivery = newDelivery(endpointId, event, payload);
        deliveryQueue.enqueue(delivery);
        return delivery;
    }

    /** Sends a {@code system.alert} test delivery to the caller's endpoint. */
    public WebhookDelivery sendTest(String endpointId, String callerId) {
        loadOwned(endpointId, callerId);
        Map<String, Object> payload = Map.of(
                "message", "Test webhook",
                "webhook_id", endpointId,
                "timestamp", LocalDateTime.now().toString());
        return deliverTo(endpointId, WebhookEventType.SYSTEM_ALERT, payload);
    }

    // ---- History & stats ----

    public List<WebhookDelivery> deliveries(String endpointId, String callerId, DeliveryStatus status, int limit) {
        loadOwned(endpointId, callerId);
        return deliveryHistory.find(endpointId, status, limit);
    }

    public DeliveryStats stats() {
        int total = deliveryHistory.size();
        long delivered = deliveryHistory.countByStatus(DeliveryStatus.DELIVERED);
        long failed = deliveryHistory.countByStatus(DeliveryStatus.FAILED);
        String successRate = total > 0 ? String.format(Locale.ROOT, "%.1f%%", delivered * 100.0 / total) : "N/A";

        return DeliveryStats.builder()
                .registeredWebhooks(webhookEndpointRegistry.size())
                .activeWebhooks(webhookEndpointRegistry.activeCount())
                .totalDeliveries(total)
                .delivered(delivered)
                .failed(failed)
                .successRate(successRate)
                .queueSize(deliveryQueue.size())
                .workerRunning(webhookDispatcher.isRunning())
                .build();
    }

    /**
     * Resolves wire names such as {@code "data.created"}.
     *
     * @throws ValidationException on the first unknown name
     */
    public static Set<WebhookEventType> parseEvents(Collection<String> wireNames) {
        Set<WebhookEventType> events = EnumSet.noneOf(WebhookEventType.class);
        for (String wireName : wireNames) {
            events.add(WebhookEventType.fromWireName(wireName));
        }
        return events;
    }

    private WebhookEndpoint loadOwned(String endpointId, String callerId) {
        WebhookEndpoint endpoint = webhookEndpointRegistry
                .find(endpointId)
                .orElseThrow(() -> ResourceNotFoundException.webhook(endpointId));
        if (!Objects.equals(endpoint.getOwnerId(), callerId)) {
            throw ForbiddenException.notOwner("Webhook", endpointId);
        }
        return endpoint;
    }

    private WebhookDelivery newDelivery(String endpointId, WebhookEventType event, Map<String, Object> payload) {
        return WebhookDelivery.builder()
                .id(UUID.randomUUID().toString())
                .endpointId(endpointId)
                .event(event)
                .payload(payload)
                .status(DeliveryStatus.PENDING)
                .attempts(0)
                .build();
    }

    /**
     * @throws ValidationException unless {@code url} is an absolute http(s) url
     */
    public static void validateUrl(String url) {
        if (isBlank(url)) {
            throw new ValidationException("url is required");
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new ValidationException("url must be an absolute http(s) url", Map.of("url", url));
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("url must be an absolute http(s) url", Map.of("url", url));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
