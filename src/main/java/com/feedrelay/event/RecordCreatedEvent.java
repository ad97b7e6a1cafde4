package com.feedrelay.event;

import com.feedrelay.domain.model.DataRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a producer record has been persisted and has its final id.
 *
 * <p>Consumers: the webhook fan-out ({@code data.created} on generic endpoints and delivery to
 * callback-mode subscriptions). Pull and push consumers read the table directly and do not
 * listen to this event.
 */
public class RecordCreatedEvent extends ApplicationEvent {

    private final DataRecord dataRecord;

    public RecordCreatedEvent(Object source, DataRecord dataRecord) {
        super(source);
        this.dataRecord = dataRecord;
    }

    public DataRecord getDataRecord() {
        return dataRecord;
    }
}
