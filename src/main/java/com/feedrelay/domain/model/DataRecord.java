package com.feedrelay.domain.model;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A record published by the ingestion side. Ids are assigned by the database and increase
 * monotonically, which is what makes them usable as a delivery cursor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataRecord {

    private Long id;

    /** Strategy the record belongs to. */
    private Long scopeId;

    private String type;
    private String symbol;
    private String source;
    private String status;
    private String description;
    private Map<String, Object> payload;
    private LocalDateTime createdAt;
}
