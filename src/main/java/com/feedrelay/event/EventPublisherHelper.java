package com.feedrelay.event;

import com.feedrelay.domain.model.DataRecord;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed factory methods
 * for the FeedRelay events.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishRecordCreated(Object source, DataRecord dataRecord) {
        applicationEventPublisher.publishEvent(new RecordCreatedEvent(source, dataRecord));
    }
}
