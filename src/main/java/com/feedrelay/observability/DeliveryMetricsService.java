package com.feedrelay.observability;

import com.feedrelay.push.ConnectionRegistry;
import com.feedrelay.webhook.DeliveryQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer metrics for the three delivery channels.
 *
 * <ul>
 *   <li><b>webhook.deliveries.delivered</b> (counter): attempts answered with 2xx</li>
 *   <li><b>webhook.deliveries.failed</b> (counter): attempts that failed, retried or not</li>
 *   <li><b>webhook.delivery.duration</b> (timer): HTTP round trip per attempt</li>
 *   <li><b>polling.records.delivered</b> (counter): records handed out by cursor polls,
 *       whether pulled over REST or forwarded on the push channel</li>
 *   <li><b>webhook.queue.depth</b> (gauge): deliveries waiting, including scheduled retries</li>
 *   <li><b>push.connections.active</b> (gauge): open push connections</li>
 * </ul>
 */
@Service
public class DeliveryMetricsService {

    private final Counter webhookDeliveredCounter;
    private final Counter webhookFailedCounter;
    private final Counter polledRecordsCounter;
    private final Timer webhookDurationTimer;

    public DeliveryMetricsService(
            MeterRegistry meterRegistry, DeliveryQueue deliveryQueue, ConnectionRegistry connectionRegistry) {
        this.webhookDeliveredCounter = Counter.builder("webhook.deliveries.delivered")
                .description("Webhook attempts answered with a 2xx status")
                .register(meterRegistry);

        this.webhookFailedCounter = Counter.builder("webhook.deliveries.failed")
                .description("Webhook attempts that failed with a non-2xx status, timeout or transport error")
                .register(meterRegistry);

        this.polledRecordsCounter = Counter.builder("polling.records.delivered")
                .description("Records returned by cursor polls")
                .register(meterRegistry);

        this.webhookDurationTimer = Timer.builder("webhook.delivery.duration")
                .description("Webhook HTTP round trip per attempt")
                .register(meterRegistry);

        meterRegistry.gauge("webhook.queue.depth", deliveryQueue, DeliveryQueue::size);
        meterRegistry.gauge("push.connections.active", connectionRegistry, ConnectionRegistry::activeCount);
    }

    public void recordWebhookDelivered(Duration elapsed) {
        webhookDeliveredCounter.increment();
        webhookDurationTimer.record(elapsed);
    }

    public void recordWebhookFailed(Duration elapsed) {
        webhookFailedCounter.increment();
        webhookDurationTimer.record(elapsed);
    }

    public void recordPolledRecords(int count) {
        if (count > 0) {
            polledRecordsCounter.increment(count);
        }
    }
}
