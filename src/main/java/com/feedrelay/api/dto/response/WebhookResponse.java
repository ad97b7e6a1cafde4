package com.feedrelay.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for a webhook endpoint. The secret is only filled in on registration.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WebhookResponse {

    private String id;
    private String url;
    private List<String> events;
    private boolean enabled;
    private Map<String, String> headers;
    private int retryCount;
    private Long timeoutSeconds;
    private Long subscriptionId;
    private LocalDateTime createdAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String secret;
}
