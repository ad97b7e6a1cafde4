package com.feedrelay.webhook;

import com.feedrelay.config.AsyncConfig;
import com.feedrelay.domain.enums.WebhookEventType;
import com.feedrelay.domain.model.DataRecord;
import com.feedrelay.domain.model.Subscription;
import com.feedrelay.event.RecordCreatedEvent;
import com.feedrelay.exception.ResourceNotFoundException;
import com.feedrelay.mapper.DataRecordMapper;
import com.feedrelay.subscription.PollingDeliveryService;
import com.feedrelay.subscription.RecordFilter;
import com.feedrelay.subscription.SubscriptionService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Turns {@link RecordCreatedEvent}s into webhook deliveries.
 *
 * <p>Generic endpoints subscribed to {@code data.created} get the record through
 * {@link WebhookService#trigger}. Each enabled CALLBACK subscription whose scope and filters
 * match gets it on its own endpoint, and its cursor moves past the record once the delivery is
 * queued. Runs on the fan-out executor, so records may arrive here out of id order; the cursor is
 * not consulted and only ever moves forward.
 */
@Component
public class RecordCreatedWebhookListener {

    private static final Logger log = LoggerFactory.getLogger(RecordCreatedWebhookListener.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final WebhookService webhookService;
    private final SubscriptionService subscriptionService;
    private final PollingDeliveryService pollingDeliveryService;
    private final RecordFilter recordFilter;
    private final DataRecordMapper dataRecordMapper;
    private final ObjectMapper objectMapper;

    public RecordCreatedWebhookListener(
            WebhookService webhookService,
            SubscriptionService subscriptionService,
            PollingDeliveryService pollingDeliveryService,
            RecordFilter recordFilter,
            DataRecordMapper dataRecordMapper,
            ObjectMapper objectMapper) {
        this.webhookService = webhookService;
        this.subscriptionService = subscriptionService;
        this.pollingDeliveryService = pollingDeliveryService;
        this.recordFilter = recordFilter;
        this.dataRecordMapper = dataRecordMapper;
        this.objectMapper = objectMapper;
    }

    @Async(AsyncConfig.FANOUT_EXECUTOR)
    @EventListener
    public void onRecordCreated(RecordCreatedEvent event) {
        DataRecord dataRecord = event.getDataRecord();
        Map<String, Object> payload = objectMapper.convertValue(dataRecordMapper.toResponse(dataRecord), MAP_TYPE);

        int triggered = webhookService.trigger(WebhookEventType.DATA_CREATED, payload);

        int callbacks = 0;
        for (Subscription subscription : subscriptionService.findActiveCallbackSubscriptions()) {
            if (!accepts(subscription, dataRecord)) {
                continue;
            }
            try {
                webhookService.deliverTo(subscription.getCallbackEndpointId(), WebhookEventType.DATA_CREATED, payload);
                pollingDeliveryService.markDelivered(subscription.getId(), dataRecord.getId());
                callbacks++;
            } catch (ResourceNotFoundException e) {
                log.warn("Callback endpoint {} of subscription {} is missing, skipping record {}",
                        subscription.getCallbackEndpointId(), subscription.getId(), dataRecord.getId());
            }
        }

        log.debug("Record {} fanned out to {} webhooks and {} callback subscriptions", dataRecord.getId(),
                triggered, callbacks);
    }

    private boolean accepts(Subscription subscription, DataRecord dataRecord) {
        if (subscription.getCallbackEndpointId() == null) {
            return false;
        }
        if (subscription.getScopeId() != null && !subscription.getScopeId().equals(dataRecord.getScopeId())) {
            return false;
        }
        return recordFilter.matches(subscription.getFilters(), dataRecord);
    }
}
