package com.feedrelay.exception;

import com.feedrelay.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestValueException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps failures of the subscription, polling, webhook and auth endpoints onto
 * {@link ApiErrorResponse}.
 *
 * <p>Relay rule violations ({@link ValidationException}) answer 422. Requests Spring rejects
 * before they reach a service (bean validation, unreadable JSON, bad path or query values)
 * answer 400.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleRelayException(BaseException ex, HttpServletRequest request) {
        if (ex.getErrorCode().isServerSide()) {
            log.error("{} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(),
                    ex.getErrorCode(), ex.getMessage());
        }
        return respond(ex.getErrorCode(), ApiErrorResponse.from(ex, request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return badRequest("Validation failed", fieldErrors, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidParameter(
            ConstraintViolationException ex, HttpServletRequest request) {
        Map<String, Object> violations = new LinkedHashMap<>();
        ex.getConstraintViolations()
                .forEach(violation -> violations.put(violation.getPropertyPath().toString(), violation.getMessage()));
        return badRequest("Validation failed", violations, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable body on {}: {}", request.getRequestURI(), ex.getMessage());
        return badRequest("Malformed request body", null, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return badRequest("Invalid value for parameter '" + ex.getName() + "'",
                Map.of(ex.getName(), String.valueOf(ex.getValue())), request);
    }

    @ExceptionHandler(MissingRequestValueException.class)
    public ResponseEntity<ApiErrorResponse> handleMissingValue(
            MissingRequestValueException ex, HttpServletRequest request) {
        return badRequest(ex.getMessage(), null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownPath(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(ErrorCode.NOT_FOUND,
                ApiErrorResponse.of(ErrorCode.NOT_FOUND, "No endpoint " + request.getRequestURI(), null,
                        request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, ApiErrorResponse.of(
                ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request.getRequestURI()));
    }

    private ResponseEntity<ApiErrorResponse> badRequest(
            String message, Map<String, Object> details, HttpServletRequest request) {
        return respond(ErrorCode.BAD_REQUEST,
                ApiErrorResponse.of(ErrorCode.BAD_REQUEST, message, details, request.getRequestURI()));
    }

    private static ResponseEntity<ApiErrorResponse> respond(ErrorCode errorCode, ApiErrorResponse body) {
        return ResponseEntity.status(errorCode.status()).body(body);
    }
}
