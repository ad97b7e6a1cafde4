package com.feedrelay.exception;

/** Rejected client credentials on the token endpoint. */
public class UnauthorizedException extends BaseException {

    public static final String INVALID_CREDENTIALS = "Invalid client credentials";

    public UnauthorizedException() {
        this(INVALID_CREDENTIALS);
    }

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
