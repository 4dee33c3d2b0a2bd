package com.omniguard.api.pipeline;

/**
 * Stages a message passes through on the way to delivery. Terminal failures report the
 * last stage reached.
 */
public enum MessageStage {
    RECEIVED,
    CONTENT_CHECKED,
    RATE_CHECKED,
    ENCRYPTED,
    PERSISTED,
    DELIVERED
}
