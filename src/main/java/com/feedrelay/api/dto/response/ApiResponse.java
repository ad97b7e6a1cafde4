package com.feedrelay.api.dto.response;

import java.time.Instant;

/**
 * Success envelope for /api responses, added by {@link com.feedrelay.config.ApiResponseAdvice}.
 */
public record ApiResponse<T>(boolean success, T data, Instant timestamp) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
