package com.omniguard.api.quota;

import com.omniguard.api.config.OmniGuardProperties;
import com.omniguard.core.domain.Identity;
import com.omniguard.core.domain.QuotaBucket;
import com.omniguard.core.domain.QuotaKey;
import com.omniguard.core.store.BoundedRetry;
import com.omniguard.core.store.PersistenceUnavailableException;
import com.omniguard.core.store.QuotaBucketStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-identity daily message allowance.
 * <p>
 * Each identity has one bucket per calendar day in the configured zone. Consumption is a
 * compare-and-set loop against the {@link QuotaBucketStore}, so concurrent senders never
 * overspend. A new day means a new bucket key, which resets the allowance exactly once.
 * If the store stays unreachable after bounded retries the check fails closed.
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final QuotaBucketStore store;
    private final Clock clock;
    private final ZoneId zone;
    private final OmniGuardProperties.TierLimits capacity;
    private final int warningThresholdPercent;
    private final BoundedRetry retry;

    public RateLimiterService(QuotaBucketStore store, OmniGuardProperties properties, Clock clock) {
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        OmniGuardProperties.Quota quota = properties.getQuota();
        this.zone = ZoneId.of(quota.getZone());
        this.capacity = quota.getCapacity();
        this.warningThresholdPercent = quota.getWarningThresholdPercent();
        this.retry = new BoundedRetry(quota.getRetry().getMaxAttempts(), quota.getRetry().getBaseBackoff());
    }

    public QuotaDecision checkAndConsume(Identity identity) {
        return checkAndConsume(identity, 1);
    }

    /**
     * Atomically consumes {@code cost} tokens from today's bucket.
     */
    public QuotaDecision checkAndConsume(Identity identity, int cost) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        if (cost < 1) {
            throw new IllegalArgumentException("Cost must be positive: " + cost);
        }

        LocalDate today = today();
        QuotaKey key = new QuotaKey(identity.id(), today);
        int tierCapacity = capacity.forTier(identity.tier());

        try {
            while (true) {
                Optional<QuotaBucket> current = retry.call("quota read", () -> store.find(key));

                if (current.isEmpty()) {
                    QuotaBucket fresh = QuotaBucket.fresh(key, tierCapacity, resetAt(today));
                    if (!fresh.canConsume(cost)) {
                        return deny(identity, fresh);
                    }
                    QuotaBucket consumed = fresh.consume(cost);
                    if (retry.call("quota create", () -> store.insertIfAbsent(consumed))) {
                        return grant(identity, consumed);
                    }
                    continue;
                }

                QuotaBucket bucket = current.get();
                if (tierCapacity > bucket.capacity()) {
                    QuotaBucket upgraded = bucket.rebase(tierCapacity);
                    if (retry.call("quota upgrade", () -> store.compareAndSet(bucket, upgraded))) {
                        log.info("Quota for identity {} raised to {} after tier change", identity.id(), tierCapacity);
                    }
                    continue;
                }
                if (!bucket.canConsume(cost)) {
                    return deny(identity, bucket);
                }
                QuotaBucket next = bucket.consume(cost);
                if (retry.call("quota update", () -> store.compareAndSet(bucket, next))) {
                    return grant(identity, next);
                }
                log.debug("Quota update for identity {} lost a race, retrying", identity.id());
            }
        } catch (PersistenceUnavailableException e) {
            log.error("Quota store unavailable for identity {}, denying", identity.id(), e);
            return QuotaDecision.unavailable();
        }
    }

    /**
     * Today's usage without consuming anything.
     *
     * @throws PersistenceUnavailableException if the store stays unreachable
     */
    public QuotaUsage usage(Identity identity) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        LocalDate today = today();
        QuotaKey key = new QuotaKey(identity.id(), today);
        int tierCapacity = capacity.forTier(identity.tier());

        QuotaBucket bucket = retry.call("quota read", () -> store.find(key))
                .orElseGet(() -> QuotaBucket.fresh(key, tierCapacity, resetAt(today)));
        int effectiveCapacity = Math.max(tierCapacity, bucket.capacity());
        int remaining = bucket.tokensRemaining() + (effectiveCapacity - bucket.capacity());
        int used = effectiveCapacity - remaining;

        return new QuotaUsage(identity.id(), identity.tier(), effectiveCapacity, used, remaining,
                bucket.resetAt(), isNearLimit(used, effectiveCapacity));
    }

    /**
     * Drops buckets from previous days. They can never be consumed again.
     */
    @Scheduled(cron = "${omniguard.quota.purge-cron:0 15 0 * * *}", zone = "${omniguard.quota.zone:UTC}")
    public void purgeExpiredBuckets() {
        try {
            int purged = retry.call("quota purge", () -> store.purgeBefore(today()));
            if (purged > 0) {
                log.info("Purged {} expired quota buckets", purged);
            }
        } catch (PersistenceUnavailableException e) {
            log.warn("Quota purge skipped, store unavailable: {}", e.getMessage());
        }
    }

    private QuotaDecision grant(Identity identity, QuotaBucket bucket) {
        if (isNearLimit(bucket.used(), bucket.capacity())) {
            log.warn("Identity {} has used {}/{} daily messages", identity.id(), bucket.used(), bucket.capacity());
        }
        return QuotaDecision.granted(bucket.tokensRemaining(), bucket.resetAt());
    }

    private QuotaDecision deny(Identity identity, QuotaBucket bucket) {
        log.warn("Daily quota exceeded for identity {} ({} tier), resets at {}",
                identity.id(), identity.tier(), bucket.resetAt());
        return QuotaDecision.exceeded(bucket.tokensRemaining(), bucket.resetAt());
    }

    private boolean isNearLimit(int used, int bucketCapacity) {
        return bucketCapacity > 0 && used * 100L >= (long) bucketCapacity * warningThresholdPercent;
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), zone);
    }

    private Instant resetAt(LocalDate day) {
        return day.plusDays(1).atStartOfDay(zone).toInstant();
    }
}
