package com.feedrelay.unit.webhook;

import static org.assertj.core.api.Assertions.assertThat;

import com.feedrelay.domain.enums.DeliveryStatus;
import com.feedrelay.domain.enums.WebhookEventType;
import com.feedrelay.domain.model.WebhookDelivery;
import com.feedrelay.webhook.DeliveryHistory;
import com.feedrelay.webhook.WebhookProperties;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DeliveryHistoryTest {

    private WebhookProperties webhookProperties;
    private DeliveryHistory deliveryHistory;

    @BeforeEach
    void setUp() {
        webhookProperties = new WebhookProperties();
        webhookProperties.setHistoryMaxSize(3);
        webhookProperties.setHistoryRetention(Duration.ofMinutes(5));
        deliveryHistory = new DeliveryHistory(webhookProperties);
    }

    private WebhookDelivery attempt(String id, String endpointId, DeliveryStatus status, LocalDateTime at) {
        return WebhookDelivery.builder()
                .id(id)
                .endpointId(endpointId)
                .event(WebhookEventType.DATA_CREATED)
                .status(status)
                .attempts(1)
                .lastAttemptAt(at)
                .build();
    }

    @Test
    @DisplayName("Keeps only the newest entries once the cap is reached")
    void capEvictsOldest() {
        LocalDateTime now = LocalDateTime.now();
        for (int i = 1; i <= 5; i++) {
            deliveryHistory.record(attempt("d" + i, "wh_a", DeliveryStatus.DELIVERED, now));
        }

        assertThat(deliveryHistory.size()).isEqualTo(3);
        assertThat(deliveryHistory.find(null, null, 10))
                .extracting(WebhookDelivery::getId)
                .containsExactly("d5", "d4", "d3");
    }

    @Test
    @DisplayName("Filters by endpoint and status, newest first, up to the limit")
    void findFilters() {
        LocalDateTime now = LocalDateTime.now();
        deliveryHistory.record(attempt("d1", "wh_a", DeliveryStatus.FAILED, now));
        deliveryHistory.record(attempt("d2", "wh_b", DeliveryStatus.FAILED, now));
        deliveryHistory.record(attempt("d3", "wh_a", DeliveryStatus.DELIVERED, now));

        assertThat(deliveryHistory.find("wh_a", null, 10))
                .extracting(WebhookDelivery::getId)
                .containsExactly("d3", "d1");
        assertThat(deliveryHistory.find(null, DeliveryStatus.FAILED, 1))
                .extracting(WebhookDelivery::getId)
                .containsExactly("d2");
        assertThat(deliveryHistory.countByStatus(DeliveryStatus.FAILED)).isEqualTo(2);
    }

    @Test
    @DisplayName("Pruning drops attempts older than the retention window")
    void pruneExpired() {
        LocalDateTime now = LocalDateTime.now();
        deliveryHistory.record(attempt("old", "wh_a", DeliveryStatus.FAILED, now.minusMinutes(10)));
        deliveryHistory.record(attempt("fresh", "wh_a", DeliveryStatus.DELIVERED, now));

        deliveryHistory.pruneExpired();

        List<WebhookDelivery> left = deliveryHistory.find(null, null, 10);
        assertThat(left).extracting(WebhookDelivery::getId).containsExactly("fresh");
    }
}
