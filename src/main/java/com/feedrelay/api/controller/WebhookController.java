package com.feedrelay.api.controller;

import com.feedrelay.api.dto.request.WebhookCreateRequest;
import com.feedrelay.api.dto.request.WebhookUpdateRequest;
import com.feedrelay.api.dto.response.WebhookDeliveryResponse;
import com.feedrelay.api.dto.response.WebhookEventResponse;
import com.feedrelay.api.dto.response.WebhookResponse;
import com.feedrelay.auth.JwtAuthFilter;
import com.feedrelay.domain.enums.DeliveryStatus;
import com.feedrelay.domain.enums.WebhookEventType;
import com.feedrelay.domain.model.DeliveryStats;
import com.feedrelay.domain.model.WebhookDelivery;
import com.feedrelay.domain.model.WebhookEndpoint;
import com.feedrelay.exception.ValidationException;
import com.feedrelay.mapper.WebhookMapper;
import com.feedrelay.webhook.WebhookService;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for webhook endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET    /api/webhooks/events} -- the event names an endpoint can subscribe to</li>
 *   <li>{@code GET    /api/webhooks/stats} -- delivery statistics</li>
 *   <li>{@code POST   /api/webhooks} -- register; the response carries the secret</li>
 *   <li>{@code GET    /api/webhooks} -- list the caller's endpoints</li>
 *   <li>{@code GET    /api/webhooks/{id}} -- get one</li>
 *   <li>{@code PATCH  /api/webhooks/{id}} -- update url, events or enabled</li>
 *   <li>{@code DELETE /api/webhooks/{id}} -- unregister</li>
 *   <li>{@code POST   /api/webhooks/{id}/enable|disable} -- toggle</li>
 *   <li>{@code POST   /api/webhooks/{id}/test} -- queue a system.alert test delivery</li>
 *   <li>{@code GET    /api/webhooks/{id}/deliveries?status&limit} -- attempt history</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {

    private final WebhookService webhookService;
    private final WebhookMapper webhookMapper;

    public WebhookController(WebhookService webhookService, WebhookMapper webhookMapper) {
        this.webhookService = webhookService;
        this.webhookMapper = webhookMapper;
    }

    @GetMapping("/events")
    public ResponseEntity<List<WebhookEventResponse>> events() {
        List<WebhookEventResponse> events = Arrays.stream(WebhookEventType.values())
                .map(type -> WebhookEventResponse.builder()
                        .name(type.name())
                        .value(type.getWireName())
                        .build())
                .toList();
        return ResponseEntity.ok(events);
    }

    @GetMapping("/stats")
    public ResponseEntity<DeliveryStats> stats() {
        return ResponseEntity.ok(webhookService.stats());
    }

    @PostMapping
    public ResponseEntity<WebhookResponse> register(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId,
            @Valid @RequestBody WebhookCreateRequest request) {
        WebhookEndpoint draft = WebhookEndpoint.builder()
                .ownerId(clientId)
                .url(request.getUrl())
                .events(WebhookService.parseEvents(request.getEvents()))
                .secret(request.getSecret())
                .headers(request.getHeaders())
                .retryCount(request.getRetryCount() != null ? request.getRetryCount() : 0)
                .timeout(request.getTimeoutSeconds() != null ? Duration.ofSeconds(request.getTimeoutSeconds()) : null)
                .enabled(true)
                .build();

        WebhookEndpoint registered = webhookService.register(draft);
        WebhookResponse response = webhookMapper.toResponse(registered);
        response.setSecret(registered.getSecret());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<WebhookResponse>> list(@RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId) {
        return ResponseEntity.ok(webhookMapper.toResponseList(webhookService.list(clientId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<WebhookResponse> get(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId, @PathVariable String id) {
        return ResponseEntity.ok(webhookMapper.toResponse(webhookService.get(id, clientId)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<WebhookResponse> update(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId,
            @PathVariable String id,
            @RequestBody WebhookUpdateRequest request) {
        WebhookEndpoint updated = webhookService.update(
                id,
                clientId,
                request.getUrl(),
                request.getEvents() != null ? WebhookService.parseEvents(request.getEvents()) : null,
                request.getEnabled());
        return ResponseEntity.ok(webhookMapper.toResponse(updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> unregister(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId, @PathVariable String id) {
        webhookService.unregister(id, clientId);
        return ResponseEntity.ok(Map.of("message", "Webhook deleted"));
    }

    @PostMapping("/{id}/enable")
    public ResponseEntity<WebhookResponse> enable(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId, @PathVariable String id) {
        return ResponseEntity.ok(webhookMapper.toResponse(webhookService.enable(id, clientId)));
    }

    @PostMapping("/{id}/disable")
    public ResponseEntity<WebhookResponse> disable(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId, @PathVariable String id) {
        return ResponseEntity.ok(webhookMapper.toResponse(webhookService.disable(id, clientId)));
    }

    @PostMapping("/{id}/test")
    public ResponseEntity<Map<String, String>> test(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId, @PathVariable String id) {
        WebhookDelivery delivery = webhookService.sendTest(id, clientId);
        return ResponseEntity.ok(Map.of("message", "Test webhook queued", "delivery_id", delivery.getId()));
    }

    @GetMapping("/{id}/deliveries")
    public ResponseEntity<List<WebhookDeliveryResponse>> deliveries(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId,
            @PathVariable String id,
            @RequestParam(required = false) DeliveryStatus status,
            @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > 200) {
            throw new ValidationException("limit must be between 1 and 200", Map.of("limit", limit));
        }
        return ResponseEntity.ok(
                webhookMapper.toDeliveryResponseList(webhookService.deliveries(id, clientId, status, limit)));
    }
}
