package com.feedrelay.webhook;

import com.feedrelay.domain.model.WebhookDelivery;
import java.time.Duration;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Webhook deliveries waiting for a worker, ordered by due time.
 *
 * <p>New deliveries are due immediately; retries are due after their backoff. Entries with the
 * same due time come out in insertion order. Retries waiting here are lost on shutdown.
 */
@Component
public class DeliveryQueue {

    private final DelayQueue<ScheduledDelivery> queue = new DelayQueue<>();
    private final AtomicLong sequence = new AtomicLong();

    public void enqueue(WebhookDelivery delivery) {
        schedule(delivery, Duration.ZERO);
    }

    public void schedule(WebhookDelivery delivery, Duration delay) {
        long dueAt = System.nanoTime() + delay.toNanos();
        queue.put(new ScheduledDelivery(delivery, dueAt, sequence.incrementAndGet()));
    }

    /** Blocks until a delivery is due. */
    public ScheduledDelivery take() throws InterruptedException {
        return queue.take();
    }

    /** Next due delivery, or null if none is due yet. */
    public ScheduledDelivery poll() {
        return queue.poll();
    }

    /** Head of the queue whether due or not, or null when empty. */
    public ScheduledDelivery peek() {
        return queue.peek();
    }

    public int size() {
        return queue.size();
    }

    public static final class ScheduledDelivery implements Delayed {

        private final WebhookDelivery delivery;
        private final long dueAtNanos;
        private final long sequence;

        ScheduledDelivery(WebhookDelivery delivery, long dueAtNanos, long sequence) {
            this.delivery = delivery;
            this.dueAtNanos = dueAtNanos;
            this.sequence = sequence;
        }

        public WebhookDelivery getDelivery() {
            return delivery;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other instanceof ScheduledDelivery that) {
                int byDueTime = Long.compare(dueAtNanos, that.dueAtNanos);
                return byDueTime != 0 ? byDueTime : Long.compare(sequence, that.sequence);
            }
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }
    }
}
