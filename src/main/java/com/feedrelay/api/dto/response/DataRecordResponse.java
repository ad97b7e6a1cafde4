package com.feedrelay.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A record as handed to consumers: in poll responses, push {@code data} frames and webhook
 * envelopes. Field names are snake_case on the wire.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DataRecordResponse {

    private Long id;

    @JsonProperty("strategy_id")
    private Long strategyId;

    private String type;
    private String symbol;
    private String source;
    private String status;
    private String description;
    private Map<String, Object> payload;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
