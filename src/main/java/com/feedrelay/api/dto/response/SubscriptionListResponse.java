package com.feedrelay.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubscriptionListResponse {

    private long total;
    private int limit;
    private int offset;
    private List<SubscriptionResponse> items;
}
