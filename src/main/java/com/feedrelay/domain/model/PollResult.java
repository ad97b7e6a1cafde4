package com.feedrelay.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one cursor poll. {@code lastId} is the cursor after the poll.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PollResult {

    private Long subscriptionId;
    private List<DataRecord> records;
    private Long lastId;
    private boolean hasMore;

    public boolean isEmpty() {
        return records == null || records.isEmpty();
    }
}
