package com.feedrelay.domain.model;

import com.feedrelay.domain.enums.DeliveryMode;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A client's standing request for records.
 *
 * <p>{@code lastDeliveredId} is the cursor: the highest record id already handed to the owner.
 * It never decreases. {@code filters} maps record field names to an expected scalar or a list
 * of accepted scalars; all entries must match.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    private Long id;
    private String name;
    private String description;

    /** Client id of the owner. Only the owner may poll, arm or modify the subscription. */
    private String ownerId;

    private DeliveryMode deliveryMode;

    /** Optional strategy id the subscription is scoped to. Null means every strategy. */
    private Long scopeId;

    private Map<String, Object> filters;

    /** Target url for CALLBACK mode. */
    private String callbackUrl;

    /** Webhook endpoint registered for this subscription in CALLBACK mode. */
    private String callbackEndpointId;

    private boolean enabled;
    private Long lastDeliveredId;
    private LocalDateTime lastDeliveredAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
