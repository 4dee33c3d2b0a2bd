package com.omniguard.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Retries store calls that fail with {@link PersistenceUnavailableException}, backing off
 * exponentially between attempts. Other exceptions propagate immediately.
 */
public class BoundedRetry {

    private static final Logger log = LoggerFactory.getLogger(BoundedRetry.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofMillis(25);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(2);

    private final int maxAttempts;
    private final Duration baseBackoff;

    public BoundedRetry(int maxAttempts, Duration baseBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
        }
        Objects.requireNonNull(baseBackoff, "Base backoff cannot be null");
        if (baseBackoff.isNegative()) {
            throw new IllegalArgumentException("Base backoff cannot be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseBackoff = baseBackoff;
    }

    public static BoundedRetry defaults() {
        return new BoundedRetry(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_BACKOFF);
    }

    /**
     * Runs the action, retrying while it throws {@link PersistenceUnavailableException}.
     *
     * @throws PersistenceUnavailableException the last failure once attempts are exhausted
     */
    public <T> T call(String operation, Supplier<T> action) {
        PersistenceUnavailableException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (PersistenceUnavailableException e) {
                lastFailure = e;
                if (attempt < maxAttempts) {
                    Duration backoff = backoffFor(attempt);
                    log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                            operation, attempt, maxAttempts, backoff.toMillis(), e.getMessage());
                    sleep(operation, backoff);
                }
            }
        }
        log.warn("{} failed after {} attempts", operation, maxAttempts);
        throw lastFailure;
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    Duration backoffFor(int attempt) {
        long multiplier = 1L << Math.min(attempt - 1, 20);
        Duration backoff = baseBackoff.multipliedBy(multiplier);
        return backoff.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : backoff;
    }

    private void sleep(String operation, Duration backoff) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceUnavailableException(operation + " interrupted during backoff", e);
        }
    }
}
