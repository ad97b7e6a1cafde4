package com.feedrelay.exception;

import java.util.Map;

/**
 * Thrown for malformed filters, unknown webhook event names and out-of-range request values.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
