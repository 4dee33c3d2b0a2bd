package com.omniguard.core.domain;

/**
 * Reasons attached to a moderation verdict. Some block delivery, others only annotate it.
 */
public enum ContentReason {
    EMPTY_MESSAGE,
    INJECTION_DETECTED,
    MODERATION_FLAGGED,
    MODERATION_UNAVAILABLE,
    CRISIS_DETECTED,
    SUSPICIOUS_CONTENT,
    TRUNCATED
}
