package com.feedrelay.api.dto.request;

import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a subscription; null fields are left unchanged. Delivery mode and scope
 * are fixed at creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionUpdateRequest {

    @Size(max = 200)
    private String name;

    private String description;
    private Map<String, Object> filters;

    @Size(max = 500)
    private String callbackUrl;

    private Boolean enabled;
}
