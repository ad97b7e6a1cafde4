package com.feedrelay.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A record submitted by a producer at POST /api/records.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataRecordRequest {

    private Long strategyId;

    @NotBlank
    @Size(max = 50)
    private String type;

    @NotBlank
    @Size(max = 50)
    private String symbol;

    @Size(max = 100)
    private String source;

    @Size(max = 20)
    private String status;

    private String description;
    private Map<String, Object> payload;
}
