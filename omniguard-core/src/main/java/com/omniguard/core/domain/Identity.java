package com.omniguard.core.domain;

import java.util.Objects;

/**
 * Opaque sender identity together with its subscription tier.
 */
public record Identity(String id, Tier tier) {

    public Identity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Identity ID cannot be null or blank");
        }
        Objects.requireNonNull(tier, "Tier cannot be null");
    }

    public static Identity of(String id, Tier tier) {
        return new Identity(id, tier);
    }

    public static Identity guest(String id) {
        return new Identity(id, Tier.GUEST);
    }
}
