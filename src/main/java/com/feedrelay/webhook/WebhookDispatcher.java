package com.feedrelay.webhook;

import com.feedrelay.domain.enums.DeliveryStatus;
import com.feedrelay.domain.model.WebhookDelivery;
import com.feedrelay.domain.model.WebhookEndpoint;
import com.feedrelay.observability.DeliveryMetricsService;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Pool of worker threads draining the {@link DeliveryQueue}.
 *
 * <p>Each attempt builds the envelope {@code {id, event, timestamp, data}}, signs the serialized
 * body, POSTs it and records a snapshot in the {@link DeliveryHistory}. A 2xx answer marks the
 * delivery DELIVERED. Anything else marks it FAILED and, while attempts remain, puts it back on
 * the queue due {@code backoffBase * 2^attempts} later.
 *
 * <p>Started and stopped through {@link SmartLifecycle}. Stopping interrupts the workers; an
 * attempt already in flight completes first, and scheduled retries are abandoned.
 */
@Component
public class WebhookDispatcher implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    public static final String EVENT_HEADER = "X-Webhook-Event";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
    public static final String DELIVERY_ID_HEADER = "X-Webhook-Delivery-Id";

    private final DeliveryQueue deliveryQueue;
    private final WebhookEndpointRegistry webhookEndpointRegistry;
    private final DeliveryHistory deliveryHistory;
    private final WebhookSender webhookSender;
    private final WebhookSigner webhookSigner;
    private final WebhookProperties webhookProperties;
    private final DeliveryMetricsService deliveryMetricsService;
    private final ObjectMapper objectMapper;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<Thread> workers = new ArrayList<>();

    public WebhookDispatcher(
            DeliveryQueue deliveryQueue,
            WebhookEndpointRegistry webhookEndpointRegistry,
            DeliveryHistory deliveryHistory,
            WebhookSender webhookSender,
            WebhookSigner webhookSigner,
            WebhookProperties webhookProperties,
            DeliveryMetricsService deliveryMetricsService,
            ObjectMapper objectMapper) {
        this.deliveryQueue = deliveryQueue;
        this.webhookEndpointRegistry = webhookEndpointRegistry;
        this.deliveryHistory = deliveryHistory;
        this.webhookSender = webhookSender;
        this.webhookSigner = webhookSigner;
        this.webhookProperties = webhookProperties;
        this.deliveryMetricsService = deliveryMetricsService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            int workerCount = Math.max(1, webhookProperties.getWorkers());
            synchronized (workers) {
                for (int i = 0; i < workerCount; i++) {
                    Thread worker = new Thread(this::workerLoop, "webhook-worker-" + i);
                    worker.setDaemon(true);
                    worker.start();
                    workers.add(worker);
                }
            }
            log.info("WebhookDispatcher started with {} workers", workerCount);
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            synchronized (workers) {
                workers.forEach(Thread::interrupt);
                workers.clear();
            }
            log.info("WebhookDispatcher stopping, {} deliveries left in queue", deliveryQueue.size());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void workerLoop() {
        while (running.get()) {
            try {
                DeliveryQueue.ScheduledDelivery next = deliveryQueue.take();
                process(next.getDelivery());
            } catch (InterruptedException e) {
                if (!running.get()) {
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("Webhook worker interrupted unexpectedly, resuming");
            } catch (RuntimeException e) {
                log.error("Unexpected error in webhook worker", e);
            }
        }
    }

    /**
     * Runs one attempt of {@code delivery} on the calling thread and schedules the retry if one
     * is due. Deliveries whose endpoint is gone or disabled are dropped.
     */
    public void process(WebhookDelivery delivery) {
        Optional<WebhookEndpoint> found = webhookEndpointRegistry.find(delivery.getEndpointId());
        if (found.isEmpty()) {
            log.info("Dropping delivery {}: endpoint {} no longer exists", delivery.getId(), delivery.getEndpointId());
            return;
        }
        WebhookEndpoint endpoint = found.get();
        if (!endpoint.isEnabled()) {
            log.info("Dropping delivery {}: endpoint {} is disabled", delivery.getId(), endpoint.getId());
            return;
        }

        delivery.setAttempts(delivery.getAttempts() + 1);
        if (delivery.getAttempts() > 1) {
            delivery.setStatus(DeliveryStatus.RETRYING);
        }
        delivery.setLastAttemptAt(LocalDateTime.now());

        String body = objectMapper.writeValueAsString(buildEnvelope(delivery));
        HttpHeaders headers = buildHeaders(delivery, endpoint, body);

        long startNanos = System.nanoTime();
        try {
            WebhookSender.SendResult result =
                    webhookSender.post(endpoint.getUrl(), body, headers, endpoint.getTimeout());
            delivery.setResponseCode(result.statusCode());
            delivery.setResponseBody(truncate(result.body()));
            if (result.isSuccess()) {
                delivery.setStatus(DeliveryStatus.DELIVERED);
                delivery.setError(null);
            } else {
                delivery.setStatus(DeliveryStatus.FAILED);
                delivery.setError("HTTP " + result.statusCode());
            }
        } catch (WebhookTransportException e) {
            delivery.setStatus(DeliveryStatus.FAILED);
            delivery.setResponseCode(null);
            delivery.setResponseBody(null);
            delivery.setError(e.getMessage());
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        deliveryHistory.record(delivery.snapshot());

        if (delivery.getStatus() == DeliveryStatus.DELIVERED) {
            deliveryMetricsService.recordWebhookDelivered(elapsed);
            log.debug("Delivery {} to {} succeeded on attempt {}", delivery.getId(), endpoint.getUrl(),
                    delivery.getAttempts());
            return;
        }

        deliveryMetricsService.recordWebhookFailed(elapsed);
        if (delivery.getAttempts() < endpoint.getRetryCount()) {
            Duration backoff = backoffFor(delivery.getAttempts());
            deliveryQueue.schedule(delivery, backoff);
            log.warn("Delivery {} to {} failed on attempt {} ({}), retrying in {}s", delivery.getId(),
                    endpoint.getUrl(), delivery.getAttempts(), delivery.getError(), backoff.toSeconds());
        } else {
            log.warn("Delivery {} to {} failed after {} attempts ({})", delivery.getId(), endpoint.getUrl(),
                    delivery.getAttempts(), delivery.getError());
        }
    }

    /** Delay before the attempt that follows attempt number {@code attempt}. */
    Duration backoffFor(int attempt) {
        return webhookProperties.getBackoffBase().multipliedBy(1L << Math.min(attempt, 30));
    }

    private Map<String, Object> buildEnvelope(WebhookDelivery delivery) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("id", delivery.getId());
        envelope.put("event", delivery.getEvent().getWireName());
        envelope.put("timestamp", Instant.now().toString());
        envelope.put("data", delivery.getPayload());
        return envelope;
    }

    private HttpHeaders buildHeaders(WebhookDelivery delivery, WebhookEndpoint endpoint, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(EVENT_HEADER, delivery.getEvent().getWireName());
        headers.set(WebhookSigner.SIGNATURE_HEADER, webhookSigner.signatureHeader(body, endpoint.getSecret()));
        headers.set(TIMESTAMP_HEADER, String.valueOf(Instant.now().getEpochSecond()));
        headers.set(DELIVERY_ID_HEADER, delivery.getId());
        if (endpoint.getHeaders() != null) {
            endpoint.getHeaders().forEach(headers::set);
        }
        return headers;
    }

    private String truncate(String responseBody) {
        int max = webhookProperties.getResponseBodyMaxLength();
        if (responseBody == null || responseBody.length() <= max) {
            return responseBody;
        }
        return responseBody.substring(0, max);
    }
}
