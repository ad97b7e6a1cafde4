package com.feedrelay.webhook;

import com.feedrelay.domain.enums.DeliveryStatus;
import com.feedrelay.domain.model.WebhookDelivery;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-memory log of webhook attempts, one snapshot per attempt.
 *
 * <p>Bounded by size (oldest dropped first) and by age (pruned once a minute). Not persisted.
 */
@Component
public class DeliveryHistory {

    private static final Logger log = LoggerFactory.getLogger(DeliveryHistory.class);

    private final WebhookProperties webhookProperties;
    private final Deque<WebhookDelivery> attempts = new ArrayDeque<>();

    public DeliveryHistory(WebhookProperties webhookProperties) {
        this.webhookProperties = webhookProperties;
    }

    public synchronized void record(WebhookDelivery snapshot) {
        attempts.addLast(snapshot);
        while (attempts.size() > webhookProperties.getHistoryMaxSize()) {
            attempts.removeFirst();
        }
    }

    /**
     * Newest-first attempts, optionally restricted to one endpoint and one status.
     */
    public synchronized List<WebhookDelivery> find(String endpointId, DeliveryStatus status, int limit) {
        List<WebhookDelivery> result = new ArrayList<>();
        Iterator<WebhookDelivery> newestFirst = attempts.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            WebhookDelivery attempt = newestFirst.next();
            if (endpointId != null && !endpointId.equals(attempt.getEndpointId())) {
                continue;
            }
            if (status != null && status != attempt.getStatus()) {
                continue;
            }
            result.add(attempt);
        }
        return result;
    }

    public synchronized int size() {
        return attempts.size();
    }

    public synchronized long countByStatus(DeliveryStatus status) {
        return attempts.stream().filter(attempt -> attempt.getStatus() == status).count();
    }

    @Scheduled(fixedDelayString = "${feedrelay.webhook.history-prune-interval:60000}")
    public void pruneExpired() {
        int removed = pruneOlderThan(LocalDateTime.now().minus(webhookProperties.getHistoryRetention()));
        if (removed > 0) {
            log.debug("Pruned {} webhook attempts past retention", removed);
        }
    }

    synchronized int pruneOlderThan(LocalDateTime cutoff) {
        int removed = 0;
        Iterator<WebhookDelivery> oldestFirst = attempts.iterator();
        while (oldestFirst.hasNext()) {
            WebhookDelivery attempt = oldestFirst.next();
            if (attempt.getLastAttemptAt() != null && attempt.getLastAttemptAt().isBefore(cutoff)) {
                oldestFirst.remove();
                removed++;
            }
        }
        return removed;
    }
}
