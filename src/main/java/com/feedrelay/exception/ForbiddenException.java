package com.feedrelay.exception;

/**
 * Thrown when a client touches a subscription or webhook endpoint owned by another client.
 */
public class ForbiddenException extends BaseException {

    private ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }

    public static ForbiddenException notOwner(String resourceType, Object id) {
        return new ForbiddenException(resourceType + " " + id + " is not owned by the caller");
    }
}
