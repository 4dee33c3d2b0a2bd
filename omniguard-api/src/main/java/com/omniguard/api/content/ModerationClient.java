package com.omniguard.api.content;

import java.util.List;

/**
 * External content moderation service.
 * Implementations may block; callers bound them with a timeout.
 */
public interface ModerationClient {

    ModerationResult moderate(String text);

    /**
     * @param flagged    whether the service considers the text harmful
     * @param categories the category names the service flagged
     */
    record ModerationResult(boolean flagged, List<String> categories) {

        public ModerationResult {
            categories = categories == null ? List.of() : List.copyOf(categories);
        }

        public static ModerationResult clean() {
            return new ModerationResult(false, List.of());
        }
    }
}
