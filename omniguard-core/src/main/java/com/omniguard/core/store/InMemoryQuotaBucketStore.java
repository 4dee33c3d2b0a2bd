package com.omniguard.core.store;

import com.omniguard.core.domain.QuotaBucket;
import com.omniguard.core.domain.QuotaKey;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Quota bucket store backed by a {@link ConcurrentHashMap}.
 */
public class InMemoryQuotaBucketStore implements QuotaBucketStore {

    private final ConcurrentMap<QuotaKey, QuotaBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public Optional<QuotaBucket> find(QuotaKey key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return Optional.ofNullable(buckets.get(key));
    }

    @Override
    public boolean insertIfAbsent(QuotaBucket bucket) {
        Objects.requireNonNull(bucket, "Bucket cannot be null");
        return buckets.putIfAbsent(bucket.key(), bucket) == null;
    }

    @Override
    public boolean compareAndSet(QuotaBucket expected, QuotaBucket replacement) {
        Objects.requireNonNull(expected, "Expected bucket cannot be null");
        Objects.requireNonNull(replacement, "Replacement bucket cannot be null");
        if (!expected.key().equals(replacement.key())) {
            throw new IllegalArgumentException("Replacement must keep the same key");
        }
        return buckets.replace(expected.key(), expected, replacement);
    }

    @Override
    public int purgeBefore(LocalDate day) {
        int before = buckets.size();
        buckets.keySet().removeIf(key -> key.day().isBefore(day));
        return before - buckets.size();
    }

    public int size() {
        return buckets.size();
    }
}
