package com.omniguard.api.quota;

import com.omniguard.api.config.OmniGuardProperties;
import com.omniguard.api.support.MutableClock;
import com.omniguard.api.support.TestProperties;
import com.omniguard.core.domain.Identity;
import com.omniguard.core.domain.QuotaBucket;
import com.omniguard.core.domain.QuotaKey;
import com.omniguard.core.domain.Tier;
import com.omniguard.core.store.InMemoryQuotaBucketStore;
import com.omniguard.core.store.PersistenceUnavailableException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Property tests for the daily quota.
 */
class RateLimiterServicePropertyTest {

    private static final Instant MID_AFTERNOON = Instant.parse("2026-03-14T15:30:00Z");
    private static final Instant NEXT_MIDNIGHT = Instant.parse("2026-03-15T00:00:00Z");

    private MutableClock clock;
    private InMemoryQuotaBucketStore store;
    private RateLimiterService rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MID_AFTERNOON);
        store = new InMemoryQuotaBucketStore();
        rateLimiter = new RateLimiterService(store, TestProperties.defaults(), clock);
    }

    // ==================== Daily Allowance ====================

    /**
     * Scenario: a guest with a daily cap of 10 sends 10 messages, the 11th is denied
     * with the next midnight as reset time.
     */
    @Test
    void guest_getsTenMessagesThenDenied() {
        Identity guest = Identity.guest("guest-1");

        for (int i = 0; i < 10; i++) {
            QuotaDecision decision = rateLimiter.checkAndConsume(guest);
            assertThat(decision.allowed()).as("message %d", i + 1).isTrue();
            assertThat(decision.remaining()).isEqualTo(9 - i);
        }
        QuotaDecision eleventh = rateLimiter.checkAndConsume(guest);

        assertThat(eleventh.allowed()).isFalse();
        assertThat(eleventh.outcome()).isEqualTo(QuotaDecision.Outcome.QUOTA_EXCEEDED);
        assertThat(eleventh.resetAt()).isEqualTo(NEXT_MIDNIGHT);
        assertThat(eleventh.remaining()).isZero();
    }

    @Test
    void denial_consumesNothing() {
        Identity guest = Identity.guest("guest-2");
        for (int i = 0; i < 10; i++) {
            rateLimiter.checkAndConsume(guest);
        }
        QuotaBucket before = store.find(new QuotaKey("guest-2", LocalDate.of(2026, 3, 14))).orElseThrow();

        rateLimiter.checkAndConsume(guest);
        rateLimiter.checkAndConsume(guest);

        assertThat(store.find(before.key())).contains(before);
    }

    @Test
    void tiers_haveDifferentCapacities() {
        assertThat(rateLimiter.checkAndConsume(Identity.of("a", Tier.GUEST)).remaining()).isEqualTo(9);
        assertThat(rateLimiter.checkAndConsume(Identity.of("b", Tier.FREE)).remaining()).isEqualTo(49);
        assertThat(rateLimiter.checkAndConsume(Identity.of("c", Tier.PREMIUM)).remaining()).isEqualTo(999);
    }

    @Test
    void cost_isConsumedAsAWhole() {
        Identity guest = Identity.guest("bulk");

        assertThat(rateLimiter.checkAndConsume(guest, 4).remaining()).isEqualTo(6);
        assertThat(rateLimiter.checkAndConsume(guest, 4).remaining()).isEqualTo(2);
        QuotaDecision tooMuch = rateLimiter.checkAndConsume(guest, 4);

        assertThat(tooMuch.allowed()).isFalse();
        assertThat(tooMuch.remaining()).isEqualTo(2);
        assertThatThrownBy(() -> rateLimiter.checkAndConsume(guest, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tierUpgrade_creditsTheDifferenceSameDay() {
        for (int i = 0; i < 10; i++) {
            rateLimiter.checkAndConsume(Identity.of("upgrader", Tier.GUEST));
        }

        QuotaDecision afterUpgrade = rateLimiter.checkAndConsume(Identity.of("upgrader", Tier.PREMIUM));

        assertThat(afterUpgrade.allowed()).isTrue();
        assertThat(afterUpgrade.remaining()).isEqualTo(1000 - 11);
    }

    // ==================== Reset ====================

    @Test
    void newDay_resetsOnceToFullCapacity() {
        Identity guest = Identity.guest("sleeper");
        for (int i = 0; i < 10; i++) {
            rateLimiter.checkAndConsume(guest);
        }
        assertThat(rateLimiter.checkAndConsume(guest).allowed()).isFalse();

        clock.set(NEXT_MIDNIGHT.plusSeconds(1));
        QuotaDecision first = rateLimiter.checkAndConsume(guest);
        QuotaDecision second = rateLimiter.checkAndConsume(guest);

        assertThat(first.allowed()).isTrue();
        assertThat(first.remaining()).isEqualTo(9);
        assertThat(first.resetAt()).isEqualTo(NEXT_MIDNIGHT.plus(Duration.ofDays(1)));
        assertThat(second.remaining()).isEqualTo(8);
    }

    @Test
    void resetAt_followsConfiguredZone() {
        OmniGuardProperties properties = TestProperties.defaults();
        properties.getQuota().setZone("America/New_York");
        // 23:00 on 13 March in New York (EDT, UTC-4)
        clock.set(Instant.parse("2026-03-14T03:00:00Z"));
        RateLimiterService newYork = new RateLimiterService(new InMemoryQuotaBucketStore(), properties, clock);

        QuotaDecision decision = newYork.checkAndConsume(Identity.guest("ny"));

        assertThat(decision.resetAt()).isEqualTo(Instant.parse("2026-03-14T04:00:00Z"));
    }

    @Test
    void purge_dropsPreviousDays() {
        rateLimiter.checkAndConsume(Identity.guest("old"));
        clock.advance(Duration.ofDays(1));
        rateLimiter.checkAndConsume(Identity.guest("new"));

        rateLimiter.purgeExpiredBuckets();

        assertThat(store.size()).isEqualTo(1);
    }

    // ==================== Usage ====================

    @Test
    void usage_reportsNearLimitWithoutConsuming() {
        Identity guest = Identity.guest("watcher");
        for (int i = 0; i < 8; i++) {
            rateLimiter.checkAndConsume(guest);
        }

        QuotaUsage usage = rateLimiter.usage(guest);
        QuotaUsage again = rateLimiter.usage(guest);

        assertThat(usage.used()).isEqualTo(8);
        assertThat(usage.remaining()).isEqualTo(2);
        assertThat(usage.nearLimit()).isTrue();
        assertThat(usage.resetAt()).isEqualTo(NEXT_MIDNIGHT);
        assertThat(again).isEqualTo(usage);
    }

    @Test
    void usage_forUnseenIdentityCreatesNoBucket() {
        QuotaUsage usage = rateLimiter.usage(Identity.of("fresh", Tier.FREE));

        assertThat(usage.remaining()).isEqualTo(50);
        assertThat(usage.nearLimit()).isFalse();
        assertThat(store.size()).isZero();
    }

    // ==================== Store Failures ====================

    @Test
    void transientStoreFailure_isRetried() {
        AtomicInteger failuresLeft = new AtomicInteger(2);
        InMemoryQuotaBucketStore flaky = new InMemoryQuotaBucketStore() {
            @Override
            public Optional<QuotaBucket> find(QuotaKey key) {
                if (failuresLeft.getAndDecrement() > 0) {
                    throw new PersistenceUnavailableException("connection reset");
                }
                return super.find(key);
            }
        };
        RateLimiterService limiter = new RateLimiterService(flaky, TestProperties.defaults(), clock);

        QuotaDecision decision = limiter.checkAndConsume(Identity.guest("patient"));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(9);
    }

    @Test
    void persistentStoreFailure_failsClosed() {
        InMemoryQuotaBucketStore down = new InMemoryQuotaBucketStore() {
            @Override
            public Optional<QuotaBucket> find(QuotaKey key) {
                throw new PersistenceUnavailableException("store down");
            }
        };
        RateLimiterService limiter = new RateLimiterService(down, TestProperties.defaults(), clock);

        QuotaDecision decision = limiter.checkAndConsume(Identity.guest("unlucky"));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.outcome()).isEqualTo(QuotaDecision.Outcome.STORE_UNAVAILABLE);
    }

    // ==================== Concurrency ====================

    /**
     * Property: N concurrent single-token requests against capacity C yield exactly
     * min(N, C) grants and no lost update.
     */
    @Property(tries = 25)
    void concurrentRequests_neverOverspend(
            @ForAll @IntRange(min = 0, max = 40) int capacity,
            @ForAll @IntRange(min = 1, max = 80) int requests) throws Exception {

        OmniGuardProperties properties = TestProperties.defaults();
        properties.getQuota().getCapacity().setGuest(capacity);
        InMemoryQuotaBucketStore sharedStore = new InMemoryQuotaBucketStore();
        RateLimiterService limiter = new RateLimiterService(sharedStore, properties, new MutableClock(MID_AFTERNOON));
        Identity identity = Identity.guest("contended");

        List<QuotaDecision> decisions = runConcurrently(requests, () -> limiter.checkAndConsume(identity));

        long granted = decisions.stream().filter(QuotaDecision::allowed).count();
        long exceeded = decisions.stream()
                .filter(d -> d.outcome() == QuotaDecision.Outcome.QUOTA_EXCEEDED)
                .count();
        assertThat(granted).isEqualTo(Math.min(requests, capacity));
        assertThat(exceeded).isEqualTo(requests - granted);
        int remaining = sharedStore.find(new QuotaKey("contended", LocalDate.of(2026, 3, 14)))
                .map(QuotaBucket::tokensRemaining)
                .orElse(capacity);
        assertThat(remaining).isEqualTo(capacity - granted);
    }

    /**
     * Property: however many requests arrive, remaining tokens stay within [0, capacity].
     */
    @Property(tries = 50)
    void remainingTokens_stayWithinCapacity(
            @ForAll("tiers") Tier tier,
            @ForAll @IntRange(min = 0, max = 60) int requests) {

        RateLimiterService limiter = new RateLimiterService(
                new InMemoryQuotaBucketStore(), TestProperties.defaults(), new MutableClock(MID_AFTERNOON));
        Identity identity = Identity.of("sequential", tier);
        int capacity = new OmniGuardProperties().getQuota().getCapacity().forTier(tier);

        for (int i = 0; i < requests; i++) {
            QuotaDecision decision = limiter.checkAndConsume(identity);
            assertThat(decision.remaining()).isBetween(0, capacity);
        }
        assertThat(limiter.usage(identity).remaining()).isEqualTo(Math.max(0, capacity - requests));
    }

    @Provide
    Arbitrary<Tier> tiers() {
        return Arbitraries.of(Tier.class);
    }

    private static <T> List<T> runConcurrently(int tasks, Callable<T> task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < tasks; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }
}
