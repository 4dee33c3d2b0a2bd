package com.omniguard.core.store;

import com.omniguard.core.domain.QuotaBucket;
import com.omniguard.core.domain.QuotaKey;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Persistence port for daily quota buckets.
 * Writes are conditional so that concurrent consumers never lose an update.
 */
public interface QuotaBucketStore {

    Optional<QuotaBucket> find(QuotaKey key);

    /**
     * Stores the bucket only if no bucket exists for its key.
     *
     * @return true if the bucket was inserted
     */
    boolean insertIfAbsent(QuotaBucket bucket);

    /**
     * Replaces {@code expected} with {@code replacement} only if the stored bucket still
     * equals {@code expected} (same version).
     *
     * @return true if the replacement was applied
     */
    boolean compareAndSet(QuotaBucket expected, QuotaBucket replacement);

    /**
     * Removes buckets for days strictly before {@code day}.
     *
     * @return number of buckets removed
     */
    int purgeBefore(LocalDate day);
}
