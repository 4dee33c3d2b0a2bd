package com.omniguard.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted daily allowance for one identity.
 * Instances are immutable; every change produces a copy with a bumped version so
 * stores can apply updates with compare-and-set.
 */
public record QuotaBucket(
        QuotaKey key,
        int capacity,
        int tokensRemaining,
        Instant resetAt,
        long version
) {

    public QuotaBucket {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(resetAt, "Reset time cannot be null");
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative: " + capacity);
        }
        if (tokensRemaining < 0 || tokensRemaining > capacity) {
            throw new IllegalArgumentException(
                    "Tokens remaining must be within [0, " + capacity + "]: " + tokensRemaining);
        }
    }

    public static QuotaBucket fresh(QuotaKey key, int capacity, Instant resetAt) {
        return new QuotaBucket(key, capacity, capacity, resetAt, 0L);
    }

    public boolean canConsume(int cost) {
        return cost > 0 && tokensRemaining >= cost;
    }

    public QuotaBucket consume(int cost) {
        if (!canConsume(cost)) {
            throw new IllegalStateException(
                    "Cannot consume " + cost + " tokens, only " + tokensRemaining + " remaining");
        }
        return new QuotaBucket(key, capacity, tokensRemaining - cost, resetAt, version + 1);
    }

    /**
     * Raises the capacity after a tier upgrade, crediting the difference to the remaining tokens.
     */
    public QuotaBucket rebase(int newCapacity) {
        if (newCapacity <= capacity) {
            throw new IllegalArgumentException("Rebase only supports raising capacity");
        }
        int credit = newCapacity - capacity;
        return new QuotaBucket(key, newCapacity, tokensRemaining + credit, resetAt, version + 1);
    }

    public int used() {
        return capacity - tokensRemaining;
    }
}
