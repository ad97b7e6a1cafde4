package com.feedrelay.api.dto.response;

import com.feedrelay.domain.model.DeliveryStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Response of GET /api/delivery/stats: webhook statistics plus push channel load.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryOverviewResponse {

    private DeliveryStats webhooks;
    private int activePushConnections;
    private int connectedClients;
}
