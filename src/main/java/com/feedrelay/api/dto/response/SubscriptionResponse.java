package com.feedrelay.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.feedrelay.domain.enums.DeliveryMode;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for a subscription. {@code callbackSecret} is only present in the
 * response to creating a CALLBACK subscription.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubscriptionResponse {

    private Long id;
    private String name;
    private String description;
    private DeliveryMode deliveryMode;
    private Long strategyId;
    private Map<String, Object> filters;
    private String callbackUrl;
    private String callbackEndpointId;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String callbackSecret;

    private boolean enabled;
    private Long lastDeliveredId;
    private LocalDateTime lastDeliveredAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
