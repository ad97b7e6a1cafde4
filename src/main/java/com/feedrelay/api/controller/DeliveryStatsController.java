package com.feedrelay.api.controller;

import com.feedrelay.api.dto.response.DeliveryOverviewResponse;
import com.feedrelay.push.ConnectionRegistry;
import com.feedrelay.webhook.WebhookService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/delivery")
public class DeliveryStatsController {

    private final WebhookService webhookService;
    private final ConnectionRegistry connectionRegistry;

    public DeliveryStatsController(WebhookService webhookService, ConnectionRegistry connectionRegistry) {
        this.webhookService = webhookService;
        this.connectionRegistry = connectionRegistry;
    }

    @GetMapping("/stats")
    public ResponseEntity<DeliveryOverviewResponse> stats() {
        return ResponseEntity.ok(DeliveryOverviewResponse.builder()
                .webhooks(webhookService.stats())
                .activePushConnections(connectionRegistry.activeCount())
                .connectedClients(connectionRegistry.connectedClients())
                .build());
    }
}
