package com.feedrelay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate webhook statistics computed over the retained attempt history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryStats {

    private int registeredWebhooks;
    private int activeWebhooks;
    private int totalDeliveries;
    private long delivered;
    private long failed;

    /** Formatted as {@code "87.5%"}, or {@code "N/A"} when there is no history. */
    private String successRate;

    private int queueSize;
    private boolean workerRunning;
}
