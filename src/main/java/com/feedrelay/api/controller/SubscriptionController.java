package com.feedrelay.api.controller;

import com.feedrelay.api.dto.request.SubscriptionCreateRequest;
import com.feedrelay.api.dto.request.SubscriptionUpdateRequest;
import com.feedrelay.api.dto.response.SubscriptionDataResponse;
import com.feedrelay.api.dto.response.SubscriptionListResponse;
import com.feedrelay.api.dto.response.SubscriptionResponse;
import com.feedrelay.auth.JwtAuthFilter;
import com.feedrelay.domain.model.PollResult;
import com.feedrelay.domain.model.Subscription;
import com.feedrelay.exception.ValidationException;
import com.feedrelay.mapper.DataRecordMapper;
import com.feedrelay.mapper.SubscriptionMapper;
import com.feedrelay.subscription.PollingDeliveryService;
import com.feedrelay.subscription.SubscriptionService;
import com.feedrelay.webhook.WebhookService;
import jakarta.validation.Valid;
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
 * REST API for the caller's subscriptions and for pulling their data.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST   /api/subscriptions} -- create</li>
 *   <li>{@code GET    /api/subscriptions?limit&offset} -- list the caller's subscriptions</li>
 *   <li>{@code GET    /api/subscriptions/{id}} -- get one</li>
 *   <li>{@code PATCH  /api/subscriptions/{id}} -- partial update</li>
 *   <li>{@code DELETE /api/subscriptions/{id}} -- delete</li>
 *   <li>{@code GET    /api/subscriptions/{id}/data?since&limit} -- cursor poll</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/subscriptions")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final PollingDeliveryService pollingDeliveryService;
    private final WebhookService webhookService;
    private final SubscriptionMapper subscriptionMapper;
    private final DataRecordMapper dataRecordMapper;

    public SubscriptionController(
            SubscriptionService subscriptionService,
            PollingDeliveryService pollingDeliveryService,
            WebhookService webhookService,
            SubscriptionMapper subscriptionMapper,
            DataRecordMapper dataRecordMapper) {
        this.subscriptionService = subscriptionService;
        this.pollingDeliveryService = pollingDeliveryService;
        this.webhookService = webhookService;
        this.subscriptionMapper = subscriptionMapper;
        this.dataRecordMapper = dataRecordMapper;
    }

    /**
     * Creates a subscription. For CALLBACK subscriptions the response carries the signing secret
     * of the callback endpoint; it is not returned again.
     */
    @PostMapping
    public ResponseEntity<SubscriptionResponse> create(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId,
            @Valid @RequestBody SubscriptionCreateRequest request) {
        Subscription draft = subscriptionMapper.toDomain(request);
        draft.setEnabled(request.getEnabled() == null || request.getEnabled());

        Subscription created = subscriptionService.create(clientId, draft);
        SubscriptionResponse response = subscriptionMapper.toResponse(created);
        if (created.getCallbackEndpointId() != null) {
            response.setCallbackSecret(
                    webhookService.get(created.getCallbackEndpointId(), clientId).getSecret());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<SubscriptionListResponse> list(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        if (limit < 1 || limit > 200) {
            throw new ValidationException("limit must be between 1 and 200", Map.of("limit", limit));
        }
        if (offset < 0) {
            throw new ValidationException("offset must not be negative", Map.of("offset", offset));
        }
        return ResponseEntity.ok(SubscriptionListResponse.builder()
                .total(subscriptionService.count(clientId))
                .limit(limit)
                .offset(offset)
                .items(subscriptionMapper.toResponseList(subscriptionService.list(clientId, limit, offset)))
                .build());
    }

    @GetMapping("/{id}")
    public ResponseEntity<SubscriptionResponse> get(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId, @PathVariable Long id) {
        return ResponseEntity.ok(subscriptionMapper.toResponse(subscriptionService.get(id, clientId)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<SubscriptionResponse> update(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId,
            @PathVariable Long id,
            @Valid @RequestBody SubscriptionUpdateRequest request) {
        return ResponseEntity.ok(subscriptionMapper.toResponse(subscriptionService.update(id, clientId, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId, @PathVariable Long id) {
        subscriptionService.delete(id, clientId);
        return ResponseEntity.ok(Map.of("message", "Subscription deleted"));
    }

    /**
     * Returns the next matching records and advances the subscription's cursor past them.
     */
    @GetMapping("/{id}/data")
    public ResponseEntity<SubscriptionDataResponse> poll(
            @RequestAttribute(JwtAuthFilter.CLIENT_ATTRIBUTE) String clientId,
            @PathVariable Long id,
            @RequestParam(required = false) Long since,
            @RequestParam(required = false) Integer limit) {
        PollResult result = pollingDeliveryService.poll(id, clientId, since, limit);
        return ResponseEntity.ok(SubscriptionDataResponse.builder()
                .subscriptionId(result.getSubscriptionId())
                .data(dataRecordMapper.toResponseList(result.getRecords()))
                .lastId(result.getLastId())
                .hasMore(result.isHasMore())
                .build());
    }
}
