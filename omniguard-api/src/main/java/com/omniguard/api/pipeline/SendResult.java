package com.omniguard.api.pipeline;

import com.omniguard.core.domain.ContentReason;

import java.time.Instant;
import java.util.Set;

/**
 * Outcome of {@link MessagePipelineService#sendMessage}. Exactly one status per call.
 *
 * @param status      terminal status
 * @param stage       last stage reached
 * @param messageId   identifier of the stored message, only when delivered
 * @param remaining   daily messages left, when known
 * @param resetAt     when the daily allowance resets, when known
 * @param reasons     content reasons from the gate
 * @param userMessage text safe to show the sender
 */
public record SendResult(
        MessageStatus status,
        MessageStage stage,
        String messageId,
        Integer remaining,
        Instant resetAt,
        Set<ContentReason> reasons,
        String userMessage
) {

    public static final String GENERIC_FAILURE = "Something went wrong, please try again.";

    public SendResult {
        reasons = reasons == null ? Set.of() : Set.copyOf(reasons);
    }

    static SendResult delivered(String messageId, int remaining, Instant resetAt, Set<ContentReason> reasons) {
        return new SendResult(MessageStatus.DELIVERED, MessageStage.DELIVERED, messageId, remaining, resetAt,
                reasons, null);
    }

    static SendResult rateLimited(Instant resetAt) {
        return new SendResult(MessageStatus.RATE_LIMITED, MessageStage.CONTENT_CHECKED, null, 0, resetAt, Set.of(),
                "You have reached your daily message limit. It resets at " + resetAt + ".");
    }

    static SendResult contentBlocked(Set<ContentReason> reasons) {
        return new SendResult(MessageStatus.CONTENT_BLOCKED, MessageStage.RECEIVED, null, null, null, reasons,
                reasons.contains(ContentReason.EMPTY_MESSAGE)
                        ? "Please enter a message."
                        : "This message could not be sent. Please rephrase and try again.");
    }

    static SendResult encryptionFailed() {
        return new SendResult(MessageStatus.ENCRYPTION_FAILED, MessageStage.RATE_CHECKED, null, null, null, Set.of(),
                GENERIC_FAILURE);
    }

    static SendResult unavailable(MessageStage stage) {
        return new SendResult(MessageStatus.UNAVAILABLE, stage, null, null, null, Set.of(), GENERIC_FAILURE);
    }

    public boolean delivered() {
        return status == MessageStatus.DELIVERED;
    }
}
