package com.feedrelay.api.dto.request;

import com.feedrelay.domain.enums.DeliveryMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a subscription. {@code callbackUrl} is required when
 * {@code deliveryMode} is CALLBACK and ignored otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionCreateRequest {

    @NotBlank
    @Size(max = 200)
    private String name;

    private String description;

    @NotNull
    private DeliveryMode deliveryMode;

    /** Restricts the subscription to one strategy's records. */
    private Long strategyId;

    /** Field name to a scalar or a list of accepted scalars, e.g. {"symbol": ["AAPL", "MSFT"]}. */
    private Map<String, Object> filters;

    @Size(max = 500)
    private String callbackUrl;

    @Builder.Default
    private Boolean enabled = true;
}
