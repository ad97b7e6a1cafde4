package com.feedrelay.mapper;

import com.feedrelay.api.dto.response.WebhookDeliveryResponse;
import com.feedrelay.api.dto.response.WebhookResponse;
import com.feedrelay.domain.enums.WebhookEventType;
import com.feedrelay.domain.model.WebhookDelivery;
import com.feedrelay.domain.model.WebhookEndpoint;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * Maps in-memory webhook endpoints and delivery snapshots to their API representations.
 * The endpoint secret is never mapped here; it is only returned once, on registration.
 */
@Mapper
public interface WebhookMapper {

    @Mapping(source = "events", target = "events", qualifiedByName = "eventsToWireNames")
    @Mapping(source = "timeout", target = "timeoutSeconds", qualifiedByName = "durationToSeconds")
    @Mapping(target = "secret", ignore = true)
    WebhookResponse toResponse(WebhookEndpoint endpoint);

    List<WebhookResponse> toResponseList(List<WebhookEndpoint> endpoints);

    @Mapping(source = "event", target = "event", qualifiedByName = "eventToWireName")
    WebhookDeliveryResponse toDeliveryResponse(WebhookDelivery delivery);

    List<WebhookDeliveryResponse> toDeliveryResponseList(List<WebhookDelivery> deliveries);

    @Named("eventsToWireNames")
    default List<String> eventsToWireNames(Set<WebhookEventType> events) {
        if (events == null) {
            return List.of();
        }
        return events.stream()
                .sorted(Comparator.naturalOrder())
                .map(WebhookEventType::getWireName)
                .toList();
    }

    @Named("eventToWireName")
    default String eventToWireName(WebhookEventType event) {
        return event != null ? event.getWireName() : null;
    }

    @Named("durationToSeconds")
    default Long durationToSeconds(Duration timeout) {
        return timeout != null ? timeout.toSeconds() : null;
    }
}
