package com.feedrelay.api.dto.response;

import com.feedrelay.domain.enums.DeliveryStatus;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One recorded webhook attempt.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WebhookDeliveryResponse {

    private String id;
    private String endpointId;
    private String event;
    private DeliveryStatus status;
    private int attempts;
    private LocalDateTime lastAttemptAt;
    private Integer responseCode;
    private String error;
}
