package com.feedrelay.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Response of GET /api/subscriptions/{id}/data.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubscriptionDataResponse {

    @JsonProperty("subscription_id")
    private Long subscriptionId;

    private List<DataRecordResponse> data;

    @JsonProperty("last_id")
    private Long lastId;

    @JsonProperty("has_more")
    private boolean hasMore;
}
