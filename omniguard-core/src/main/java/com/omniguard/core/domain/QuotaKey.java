package com.omniguard.core.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Identifies one identity's quota bucket for one calendar day in the quota zone.
 */
public record QuotaKey(String identityId, LocalDate day) {

    public QuotaKey {
        if (identityId == null || identityId.isBlank()) {
            throw new IllegalArgumentException("Identity ID cannot be null or blank");
        }
        Objects.requireNonNull(day, "Day cannot be null");
    }
}
