package com.feedrelay.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering a webhook endpoint. Events use their wire names
 * ("data.created"); omitted secret, retry count and timeout get generated or default values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookCreateRequest {

    @NotBlank
    private String url;

    @NotEmpty
    private List<String> events;

    private String secret;
    private Map<String, String> headers;

    @Min(1)
    private Integer retryCount;

    @Min(1)
    private Integer timeoutSeconds;
}
