package com.feedrelay.domain.enums;

public enum DeliveryStatus {
    PENDING,
    RETRYING,
    DELIVERED,
    FAILED
}
