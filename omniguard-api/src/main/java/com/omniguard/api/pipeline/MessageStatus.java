package com.omniguard.api.pipeline;

public enum MessageStatus {
    DELIVERED,
    RATE_LIMITED,
    CONTENT_BLOCKED,
    ENCRYPTION_FAILED,
    UNAVAILABLE
}
