package com.omniguard.core.domain;

import java.util.Locale;

/**
 * Subscription tier of a sender. Determines the daily message allowance.
 */
public enum Tier {
    GUEST,
    FREE,
    PREMIUM;

    /**
     * Parses a tier name case-insensitively. Unknown or missing values map to
     * {@link #GUEST}, the most restrictive tier.
     */
    public static Tier fromName(String value) {
        if (value == null || value.isBlank()) {
            return GUEST;
        }
        try {
            return Tier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GUEST;
        }
    }
}
