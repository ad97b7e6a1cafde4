package com.feedrelay.api.dto.response;

import com.feedrelay.exception.BaseException;
import com.feedrelay.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;

/**
 * Error envelope returned by every /api endpoint and by the JWT filter:
 * {@code {success: false, error: {code, message, details, timestamp, path}}}.
 */
public record ApiErrorResponse(boolean success, Failure error) {

    public record Failure(String code, String message, Map<String, Object> details, Instant timestamp, String path) {}

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Failure failure = new Failure(
                errorCode.name(), message, details != null ? details : Map.of(), Instant.now(), path);
        return new ApiErrorResponse(false, failure);
    }

    public static ApiErrorResponse from(BaseException ex, String path) {
        return of(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), path);
    }
}
