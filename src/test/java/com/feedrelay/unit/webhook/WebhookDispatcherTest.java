package com.feedrelay.unit.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.feedrelay.domain.enums.DeliveryStatus;
import com.feedrelay.domain.enums.WebhookEventType;
import com.feedrelay.domain.model.WebhookDelivery;
import com.feedrelay.domain.model.WebhookEndpoint;
import com.feedrelay.observability.DeliveryMetricsService;
import com.feedrelay.webhook.DeliveryHistory;
import com.feedrelay.webhook.DeliveryQueue;
import com.feedrelay.webhook.WebhookDispatcher;
import com.feedrelay.webhook.WebhookEndpointRegistry;
import com.feedrelay.webhook.WebhookProperties;
import com.feedrelay.webhook.WebhookSender;
import com.feedrelay.webhook.WebhookSigner;
import com.feedrelay.webhook.WebhookTransportException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

@ExtendWith(MockitoExtension.class)
class WebhookDispatcherTest {

    private static final String URL = "https://hooks.example.com/in";
    private static final String SECRET = "endpoint-secret";

    @Mock
    private WebhookSender webhookSender;

    @Mock
    private DeliveryMetricsService deliveryMetricsService;

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private final WebhookSigner webhookSigner = new WebhookSigner();

    private WebhookProperties webhookProperties;
    private DeliveryQueue deliveryQueue;
    private WebhookEndpointRegistry webhookEndpointRegistry;
    private DeliveryHistory deliveryHistory;
    private WebhookDispatcher webhookDispatcher;

    @BeforeEach
    void setUp() {
        webhookProperties = new WebhookProperties();
        deliveryQueue = new DeliveryQueue();
        webhookEndpointRegistry = new WebhookEndpointRegistry();
        deliveryHistory = new DeliveryHistory(webhookProperties);
        webhookDispatcher = new WebhookDispatcher(
                deliveryQueue,
                webhookEndpointRegistry,
                deliveryHistory,
                webhookSender,
                webhookSigner,
                webhookProperties,
                deliveryMetricsService,
                objectMapper);
    }

    private WebhookEndpoint registerEndpoint(int retryCount) {
        return webhookEndpointRegistry.save(WebhookEndpoint.builder()
                .id("wh_00000000000000aa")
                .ownerId("client-a")
                .url(URL)
                .secret(SECRET)
                .events(EnumSet.of(WebhookEventType.DATA_CREATED))
                .enabled(true)
                .headers(Map.of("X-Tenant", "acme"))
                .retryCount(retryCount)
                .timeout(Duration.ofSeconds(30))
                .createdAt(LocalDateTime.now())
                .build());
    }

    private WebhookDelivery pendingDelivery() {
        return WebhookDelivery.builder()
                .id("delivery-1")
                .endpointId("wh_00000000000000aa")
                .event(WebhookEventType.DATA_CREATED)
                .payload(Map.of("id", 3, "symbol", "AAPL"))
                .status(DeliveryStatus.PENDING)
                .build();
    }

    @Test
    @DisplayName("2xx answer marks the delivery DELIVERED with a signed envelope and all headers")
    void deliversSignedEnvelope() throws Exception {
        registerEndpoint(3);
        when(webhookSender.post(eq(URL), anyString(), any(HttpHeaders.class), eq(Duration.ofSeconds(30))))
                .thenReturn(new WebhookSender.SendResult(204, null));

        WebhookDelivery delivery = pendingDelivery();
        webhookDispatcher.process(delivery);

        ArgumentCaptor<String> bodyCaptor = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<HttpHeaders> headersCaptor = ArgumentCaptor.forClass(HttpHeaders.class);
        verify(webhookSender).post(eq(URL), bodyCaptor.capture(), headersCaptor.capture(), any());

        String body = bodyCaptor.getValue();
        Map<?, ?> envelope = objectMapper.readValue(body, Map.class);
        assertThat(envelope.get("id")).isEqualTo("delivery-1");
        assertThat(envelope.get("event")).isEqualTo("data.created");
        assertThat(envelope.get("timestamp")).isNotNull();
        assertThat((Map<Object, Object>) envelope.get("data")).containsEntry("symbol", "AAPL");

        HttpHeaders headers = headersCaptor.getValue();
        assertThat(headers.getFirst("Content-Type")).isEqualTo("application/json");
        assertThat(headers.getFirst("X-Webhook-Event")).isEqualTo("data.created");
        assertThat(headers.getFirst("X-Webhook-Signature")).isEqualTo("sha256=" + webhookSigner.sign(body, SECRET));
        assertThat(headers.getFirst("X-Webhook-Delivery-Id")).isEqualTo("delivery-1");
        assertThat(headers.getFirst("X-Webhook-Timestamp")).matches("\\d+");
        assertThat(headers.getFirst("X-Tenant")).isEqualTo("acme");

        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(delivery.getAttempts()).isEqualTo(1);
        assertThat(delivery.getResponseCode()).isEqualTo(204);
        assertThat(deliveryQueue.size()).isZero();
        assertThat(deliveryHistory.find(null, null, 10)).hasSize(1);
        verify(deliveryMetricsService).recordWebhookDelivered(any(Duration.class));
    }

    @Test
    @DisplayName("Non-2xx answer records HTTP <code> and schedules a retry")
    void nonSuccessSchedulesRetry() throws Exception {
        registerEndpoint(3);
        when(webhookSender.post(any(), any(), any(), any())).thenReturn(new WebhookSender.SendResult(503, "busy"));

        WebhookDelivery delivery = pendingDelivery();
        webhookDispatcher.process(delivery);

        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(delivery.getError()).isEqualTo("HTTP 503");
        assertThat(delivery.getResponseBody()).isEqualTo("busy");
        assertThat(deliveryQueue.size()).isEqualTo(1);
        verify(deliveryMetricsService).recordWebhookFailed(any(Duration.class));
    }

    @Test
    @DisplayName("Budget 2 against an always-timing-out target: 2 attempts, retry due about 2s after the first, final FAILED")
    void timeoutRetryScenario() throws Exception {
        registerEndpoint(2);
        when(webhookSender.post(any(), any(), any(), any()))
                .thenThrow(new WebhookTransportException("Timeout", null));

        WebhookDelivery delivery = pendingDelivery();
        webhookDispatcher.process(delivery);

        DeliveryQueue.ScheduledDelivery retry = deliveryQueue.peek();
        assertThat(retry).isNotNull();
        assertThat(retry.getDelay(TimeUnit.MILLISECONDS)).isBetween(1_500L, 2_000L);
        assertThat(delivery.getError()).isEqualTo("Timeout");

        webhookDispatcher.process(deliveryQueue.peek().getDelivery());

        List<WebhookDelivery> attempts = deliveryHistory.find("wh_00000000000000aa", null, 10);
        assertThat(attempts).hasSize(2);
        assertThat(attempts.get(0).getAttempts()).isEqualTo(2);
        assertThat(attempts.get(0).getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(attempts.get(1).getAttempts()).isEqualTo(1);
        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.FAILED);
        // the retry entry is still the one peeked; nothing new was scheduled
        assertThat(deliveryQueue.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("An always-failing target is attempted exactly retryCount times")
    void retryBound() throws Exception {
        webhookProperties.setBackoffBase(Duration.ZERO);
        registerEndpoint(4);
        when(webhookSender.post(any(), any(), any(), any())).thenReturn(new WebhookSender.SendResult(500, null));

        WebhookDelivery delivery = pendingDelivery();
        webhookDispatcher.process(delivery);
        DeliveryQueue.ScheduledDelivery next;
        while ((next = deliveryQueue.poll()) != null) {
            webhookDispatcher.process(next.getDelivery());
        }

        verify(webhookSender, times(4)).post(any(), any(), any(), any());
        assertThat(delivery.getAttempts()).isEqualTo(4);
        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(deliveryHistory.countByStatus(DeliveryStatus.FAILED)).isEqualTo(4);
    }

    @Test
    @DisplayName("Second and later attempts report RETRYING while in flight")
    void retryingStatusDuringLaterAttempts() throws Exception {
        registerEndpoint(3);
        WebhookDelivery delivery = pendingDelivery();
        delivery.setAttempts(1);
        delivery.setStatus(DeliveryStatus.FAILED);
        when(webhookSender.post(any(), any(), any(), any())).thenAnswer(inv -> {
            assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.RETRYING);
            return new WebhookSender.SendResult(200, "ok");
        });

        webhookDispatcher.process(delivery);

        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(delivery.getAttempts()).isEqualTo(2);
    }

    @Nested
    @DisplayName("Dropped deliveries")
    class Dropped {

        @Test
        @DisplayName("Delivery for a deleted endpoint is dropped without an attempt")
        void deletedEndpoint() {
            webhookDispatcher.process(pendingDelivery());

            verifyNoInteractions(webhookSender);
            assertThat(deliveryHistory.size()).isZero();
        }

        @Test
        @DisplayName("Delivery for a disabled endpoint is dropped without an attempt")
        void disabledEndpoint() throws Exception {
            registerEndpoint(3);
            webhookEndpointRegistry.update("wh_00000000000000aa", endpoint -> {
                endpoint.setEnabled(false);
                return endpoint;
            });

            webhookDispatcher.process(pendingDelivery());

            verify(webhookSender, never()).post(any(), any(), any(), any());
        }
    }

    @Test
    @DisplayName("Backoff doubles with each attempt")
    void backoffDoubles() throws Exception {
        webhookProperties.setBackoffBase(Duration.ofMillis(100));
        registerEndpoint(5);
        when(webhookSender.post(any(), any(), any(), any())).thenReturn(new WebhookSender.SendResult(500, null));

        WebhookDelivery delivery = pendingDelivery();
        delivery.setAttempts(2);
        webhookDispatcher.process(delivery);

        // after attempt 3 the next one is due 100ms * 2^3 later
        assertThat(deliveryQueue.peek().getDelay(TimeUnit.MILLISECONDS)).isBetween(700L, 800L);
    }

    @Test
    @DisplayName("Worker threads drain the queue once started and stop on request")
    void lifecycle() throws Exception {
        registerEndpoint(1);
        when(webhookSender.post(any(), any(), any(), any())).thenReturn(new WebhookSender.SendResult(200, "ok"));

        webhookDispatcher.start();
        try {
            assertThat(webhookDispatcher.isRunning()).isTrue();
            deliveryQueue.enqueue(pendingDelivery());

            long deadline = System.currentTimeMillis() + 5_000;
            while (deliveryHistory.size() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        } finally {
            webhookDispatcher.stop();
        }

        assertThat(deliveryHistory.countByStatus(DeliveryStatus.DELIVERED)).isEqualTo(1);
        assertThat(webhookDispatcher.isRunning()).isFalse();
    }
}
