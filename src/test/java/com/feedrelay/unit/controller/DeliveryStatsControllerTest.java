package com.feedrelay.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.feedrelay.api.controller.DeliveryStatsController;
import com.feedrelay.config.ApiResponseAdvice;
import com.feedrelay.domain.model.DeliveryStats;
import com.feedrelay.push.ConnectionRegistry;
import com.feedrelay.push.PushConnection;
import com.feedrelay.webhook.WebhookService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.socket.WebSocketSession;

@ExtendWith(MockitoExtension.class)
class DeliveryStatsControllerTest {

    private MockMvc mockMvc;

    @Mock
    private WebhookService webhookService;

    private final ConnectionRegistry connectionRegistry = new ConnectionRegistry();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new DeliveryStatsController(webhookService, connectionRegistry))
                .setControllerAdvice(new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/delivery/stats combines webhook stats with push connection counts")
    void combinesStats() throws Exception {
        connectionRegistry.register(new PushConnection("c1", "client-a", Mockito.mock(WebSocketSession.class)));
        connectionRegistry.register(new PushConnection("c2", "client-a", Mockito.mock(WebSocketSession.class)));
        when(webhookService.stats()).thenReturn(DeliveryStats.builder().successRate("N/A").build());

        mockMvc.perform(get("/api/delivery/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.webhooks.successRate").value("N/A"))
                .andExpect(jsonPath("$.data.activePushConnections").value(2))
                .andExpect(jsonPath("$.data.connectedClients").value(1));
    }
}
