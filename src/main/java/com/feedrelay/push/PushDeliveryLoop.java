package com.feedrelay.push;

import com.feedrelay.api.websocket.PushFrame;
import com.feedrelay.domain.model.PollResult;
import com.feedrelay.exception.ForbiddenException;
import com.feedrelay.exception.ResourceNotFoundException;
import com.feedrelay.mapper.DataRecordMapper;
import com.feedrelay.subscription.PollingDeliveryService;
import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Periodic delivery task of a push connection.
 *
 * <p>Every poll interval the task polls each armed subscription through the
 * {@link PollingDeliveryService} and forwards non-empty batches as {@code data} frames. A
 * subscription that fails is logged and skipped for that round; one that has disappeared or
 * changed hands is disarmed. Cursor advances happen inside the poll, so cancelling the task
 * between polls loses no progress.
 */
@Component
public class PushDeliveryLoop {

    private static final Logger log = LoggerFactory.getLogger(PushDeliveryLoop.class);

    private final TaskScheduler pushTaskScheduler;
    private final PollingDeliveryService pollingDeliveryService;
    private final DataRecordMapper dataRecordMapper;
    private final PushProperties pushProperties;
    private final ObjectMapper objectMapper;

    public PushDeliveryLoop(
            @Qualifier("pushTaskScheduler") TaskScheduler pushTaskScheduler,
            PollingDeliveryService pollingDeliveryService,
            DataRecordMapper dataRecordMapper,
            PushProperties pushProperties,
            ObjectMapper objectMapper) {
        this.pushTaskScheduler = pushTaskScheduler;
        this.pollingDeliveryService = pollingDeliveryService;
        this.dataRecordMapper = dataRecordMapper;
        this.pushProperties = pushProperties;
        this.objectMapper = objectMapper;
    }

    public void start(PushConnection connection) {
        ScheduledFuture<?> task = pushTaskScheduler.scheduleWithFixedDelay(
                () -> deliverOnce(connection),
                Instant.now().plus(pushProperties.getPollInterval()),
                pushProperties.getPollInterval());
        connection.setDeliveryTask(task);
        log.debug("Delivery loop started for connection {}", connection.getId());
    }

    public void stop(PushConnection connection) {
        ScheduledFuture<?> task = connection.getDeliveryTask();
        if (task != null) {
            task.cancel(false);
            connection.setDeliveryTask(null);
            log.debug("Delivery loop stopped for connection {}", connection.getId());
        }
    }

    /** One delivery round over the connection's armed subscriptions. */
    public void deliverOnce(PushConnection connection) {
        for (Long subscriptionId : connection.armedSubscriptions()) {
            if (!connection.isOpen()) {
                return;
            }
            try {
                PollResult result = pollingDeliveryService.poll(
                        subscriptionId, connection.getClientId(), null, pushProperties.getBatchSize());
                if (result.isEmpty()) {
                    continue;
                }
                PushFrame frame = PushFrame.data(
                        subscriptionId, dataRecordMapper.toResponseList(result.getRecords()), result.isHasMore());
                connection.send(objectMapper.writeValueAsString(frame));
            } catch (ResourceNotFoundException | ForbiddenException e) {
                connection.disarm(subscriptionId);
                log.warn("Disarmed subscription {} on connection {}: {}", subscriptionId, connection.getId(),
                        e.getMessage());
            } catch (IOException e) {
                log.warn("Failed to push subscription {} on connection {}: {}", subscriptionId, connection.getId(),
                        e.getMessage());
            } catch (RuntimeException e) {
                log.error("Delivery of subscription {} on connection {} failed", subscriptionId, connection.getId(),
                        e);
            }
        }
    }
}
