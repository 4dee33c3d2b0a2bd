package com.omniguard.core.domain;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of the content gate for one message.
 *
 * @param allowed       whether the message may continue down the pipeline
 * @param reasons       why it was blocked or what was noticed about it
 * @param severity      crisis severity, {@link Severity#NONE} when no crisis language was found
 * @param sanitizedText normalized text to encrypt; empty when blocked
 * @param categories    detector or moderation categories that matched
 */
public record ModerationVerdict(
        boolean allowed,
        Set<ContentReason> reasons,
        Severity severity,
        String sanitizedText,
        List<String> categories
) {

    public ModerationVerdict {
        Objects.requireNonNull(severity, "Severity cannot be null");
        reasons = reasons == null || reasons.isEmpty() ? Set.of() : Set.copyOf(reasons);
        sanitizedText = sanitizedText == null ? "" : sanitizedText;
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public static ModerationVerdict allowed(String sanitizedText, Set<ContentReason> reasons,
                                            Severity severity, List<String> categories) {
        return new ModerationVerdict(true, reasons, severity, sanitizedText, categories);
    }

    public static ModerationVerdict blocked(Set<ContentReason> reasons, Severity severity, List<String> categories) {
        return new ModerationVerdict(false, reasons, severity, "", categories);
    }

    public static ModerationVerdict blocked(ContentReason reason) {
        return blocked(EnumSet.of(reason), Severity.NONE, List.of());
    }

    public boolean hasReason(ContentReason reason) {
        return reasons.contains(reason);
    }

    public boolean crisisDetected() {
        return severity.isCrisis();
    }
}
