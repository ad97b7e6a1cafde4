package com.feedrelay.api.dto.request;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookUpdateRequest {

    private String url;
    private List<String> events;
    private Boolean enabled;
}
