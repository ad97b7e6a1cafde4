package com.feedrelay.subscription;

import com.feedrelay.api.dto.request.SubscriptionUpdateRequest;
import com.feedrelay.domain.enums.DeliveryMode;
import com.feedrelay.domain.enums.WebhookEventType;
import com.feedrelay.domain.model.Subscription;
import com.feedrelay.domain.model.WebhookEndpoint;
import com.feedrelay.entity.SubscriptionEntity;
import com.feedrelay.exception.ForbiddenException;
import com.feedrelay.exception.ResourceNotFoundException;
import com.feedrelay.exception.ValidationException;
import com.feedrelay.mapper.SubscriptionMapper;
import com.feedrelay.repository.jpa.SubscriptionJpaRepository;
import com.feedrelay.webhook.WebhookService;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * CRUD for subscriptions, scoped to the calling client.
 *
 * <p>A CALLBACK subscription owns a webhook endpoint registered for its callback url. The
 * endpoint is created with the subscription, follows its enabled flag and url, and is removed
 * with it. Lifecycle changes are announced as {@code subscription.*} webhook events to the
 * owner's endpoints.
 */
@Service
public class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final SubscriptionJpaRepository subscriptionJpaRepository;
    private final SubscriptionMapper subscriptionMapper;
    private final RecordFilter recordFilter;
    private final WebhookService webhookService;
    private final PollingDeliveryService pollingDeliveryService;

    public SubscriptionService(
            SubscriptionJpaRepository subscriptionJpaRepository,
            SubscriptionMapper subscriptionMapper,
            RecordFilter recordFilter,
            WebhookService webhookService,
            PollingDeliveryService pollingDeliveryService) {
        this.subscriptionJpaRepository = subscriptionJpaRepository;
        this.subscriptionMapper = subscriptionMapper;
        this.recordFilter = recordFilter;
        this.webhookService = webhookService;
        this.pollingDeliveryService = pollingDeliveryService;
    }

    /**
     * Creates a subscription owned by {@code ownerId}. The cursor starts empty, so the first poll
     * sees every matching record already stored.
     *
     * @throws ValidationException for malformed filters or a CALLBACK subscription without a valid
 *     http(s) url; nothing is stored in that case
     */
    public Subscription create(String ownerId, Subscription draft) {
        recordFilter.validate(draft.getFilters());
        if (draft.getDeliveryMode() == DeliveryMode.CALLBACK) {
            if (isBlank(draft.getCallbackUrl())) {
                throw new ValidationException("callbackUrl is required for CALLBACK subscriptions");
            }
            WebhookService.validateUrl(draft.getCallbackUrl());
        }

        LocalDateTime now = LocalDateTime.now();
        draft.setId(null);
        draft.setOwnerId(ownerId);
        draft.setCallbackEndpointId(null);
        draft.setLastDeliveredId(null);
        draft.setLastDeliveredAt(null);
        draft.setCreatedAt(now);
        draft.setUpdatedAt(now);
        if (draft.getDeliveryMode() != DeliveryMode.CALLBACK) {
            draft.setCallbackUrl(null);
        }

        SubscriptionEntity saved = subscriptionJpaRepository.save(subscriptionMapper.toEntity(draft));

        if (saved.getDeliveryMode() == DeliveryMode.CALLBACK) {
            WebhookEndpoint endpoint;
            try {
                endpoint = webhookService.register(WebhookEndpoint.builder()
                        .ownerId(ownerId)
                        .url(saved.getCallbackUrl())
                        .events(EnumSet.of(WebhookEventType.DATA_CREATED))
                        .enabled(saved.isEnabled())
                        .subscriptionId(saved.getId())
                        .build());
            } catch (RuntimeException e) {
                subscriptionJpaRepository.deleteById(saved.getId());
                throw e;
            }
            saved.setCallbackEndpointId(endpoint.getId());
            saved = subscriptionJpaRepository.save(saved);
        }

        Subscription subscription = subscriptionMapper.toDomain(saved);
        log.info("Created {} subscription {} for client {}", subscription.getDeliveryMode(), subscription.getId(),
                ownerId);
        announce(WebhookEventType.SUBSCRIPTION_CREATED, subscription);
        return subscription;
    }

    /**
     * @throws ResourceNotFoundException if the subscription does not exist
     * @throws ForbiddenException if it belongs to another client
     */
    public Subscription get(Long subscriptionId, String callerId) {
        Subscription subscription = subscriptionJpaRepository
                .findById(subscriptionId)
                .map(subscriptionMapper::toDomain)
                .orElseThrow(() -> ResourceNotFoundException.subscription(subscriptionId));
        if (!subscription.getOwnerId().equals(callerId)) {
            throw ForbiddenException.notOwner("Subscription", subscriptionId);
        }
        return subscription;
    }

    /** True when the subscription exists and belongs to {@code callerId}. */
    public boolean isOwnedBy(Long subscriptionId, String callerId) {
        return subscriptionJpaRepository
                .findById(subscriptionId)
                .map(entity -> entity.getOwnerId().equals(callerId))
                .orElse(false);
    }

    /**
     * The caller's subscriptions in id order, skipping {@code offset} and returning up to {@code limit}.
     *
     * @throws ValidationException if {@code offset + limit} does not fit a page size
     */
    public List<Subscription> list(String ownerId, int limit, int offset) {
        long pageEnd = (long) offset + limit;
        if (pageEnd > Integer.MAX_VALUE) {
            throw new ValidationException("offset is too large", Map.of("offset", offset, "limit", limit));
        }
        List<SubscriptionEntity> upToPage =
                subscriptionJpaRepository.findByOwnerIdOrderByIdAsc(ownerId, PageRequest.of(0, (int) pageEnd));
        if (upToPage.size() <= offset) {
            return List.of();
        }
        return subscriptionMapper.toDomainList(upToPage.subList(offset, upToPage.size()));
    }

    public long count(String ownerId) {
        return subscriptionJpaRepository.countByOwnerId(ownerId);
    }

    /** Enabled CALLBACK subscriptions, the targets of record-created callbacks. */
    public List<Subscription> findActiveCallbackSubscriptions() {
        return subscriptionMapper.toDomainList(
                subscriptionJpaRepository.findByDeliveryModeAndEnabledTrue(DeliveryMode.CALLBACK));
    }

    /**
     * Applies the non-null fields of {@code request}. The cursor is never touched here.
     */
    public Subscription update(Long subscriptionId, String callerId, SubscriptionUpdateRequest request) {
        Subscription current = get(subscriptionId, callerId);
        if (request.getFilters() != null) {
            recordFilter.validate(request.getFilters());
        }

        SubscriptionEntity entity = subscriptionJpaRepository
                .findById(subscriptionId)
                .orElseThrow(() -> ResourceNotFoundException.subscription(subscriptionId));
        if (request.getName() != null) {
            entity.setName(request.getName());
        }
        if (request.getDescription() != null) {
            entity.setDescription(request.getDescription());
        }
        if (request.getFilters() != null) {
            entity.setFilters(subscriptionMapper.mapToJson(new LinkedHashMap<>(request.getFilters())));
        }
        if (request.getCallbackUrl() != null && current.getDeliveryMode() == DeliveryMode.CALLBACK) {
            if (request.getCallbackUrl().isBlank()) {
                throw new ValidationException("callbackUrl is required for CALLBACK subscriptions");
            }
            entity.setCallbackUrl(request.getCallbackUrl());
        }
        if (request.getEnabled() != null) {
            entity.setEnabled(request.getEnabled());
        }
        entity.setUpdatedAt(LocalDateTime.now());

        if (current.getCallbackEndpointId() != null) {
            webhookService.update(current.getCallbackEndpointId(), callerId, entity.getCallbackUrl(), null,
                    entity.isEnabled());
        }

        Subscription updated = subscriptionMapper.toDomain(subscriptionJpaRepository.save(entity));
        log.info("Updated subscription {}", subscriptionId);

        if (current.isEnabled() != updated.isEnabled()) {
            announce(updated.isEnabled()
                    ? WebhookEventType.SUBSCRIPTION_ACTIVATED
                    : WebhookEventType.SUBSCRIPTION_DEACTIVATED, updated);
        }
        return updated;
    }

    public void delete(Long subscriptionId, String callerId) {
        Subscription subscription = get(subscriptionId, callerId);
        if (subscription.getCallbackEndpointId() != null) {
            webhookService.unregisterInternal(subscription.getCallbackEndpointId());
        }
        subscriptionJpaRepository.deleteById(subscriptionId);
        pollingDeliveryService.forget(subscriptionId);
        log.info("Deleted subscription {}", subscriptionId);
        announce(WebhookEventType.SUBSCRIPTION_DELETED, subscription);
    }

    private void announce(WebhookEventType event, Subscription subscription) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subscription_id", subscription.getId());
        payload.put("name", subscription.getName());
        payload.put("delivery_mode", subscription.getDeliveryMode().name());
        payload.put("enabled", subscription.isEnabled());
        webhookService.trigger(event, payload, subscription.getOwnerId());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
