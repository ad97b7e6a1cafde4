package com.feedrelay.exception;

import java.util.Map;

/**
 * A subscription or webhook endpoint id that does not resolve. Unknown ids and ids that were
 * deleted are reported the same way.
 */
public class ResourceNotFoundException extends BaseException {

    private ResourceNotFoundException(String resourceType, Object id) {
        super(ErrorCode.NOT_FOUND, resourceType + " " + id + " not found", Map.of("resource", resourceType, "id", id));
    }

    public static ResourceNotFoundException subscription(Long subscriptionId) {
        return ResourceNotFoundException.subscription(subscriptionId);
    }

    public static ResourceNotFoundException webhook(String endpointId) {
        return ResourceNotFoundException.webhook(endpointId);
    }
}
