package com.omniguard.api.config;

import com.omniguard.core.domain.Identity;
import com.omniguard.core.domain.Tier;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.BucketConfiguration;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TokensInheritanceStrategy;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-window request throttling using Bucket4j.
 * <p>
 * This guards the message endpoints against bursts. It is independent of the daily
 * message allowance and never consumes from it. There is one bucket per identity; a tier
 * change resizes that bucket and keeps the tokens already spent.
 */
@Configuration
public class RequestThrottleConfig {

    private final Map<String, TieredBucket> buckets = new ConcurrentHashMap<>();
    private final OmniGuardProperties.TierLimits requestsPerMinute;

    public RequestThrottleConfig(OmniGuardProperties properties) {
        this.requestsPerMinute = properties.getThrottle().getRequestsPerMinute();
    }

    /**
     * Per-minute bucket for an identity, sized by its current tier.
     */
    public Bucket resolveBucket(Identity identity) {
        return buckets.compute(identity.id(), (id, existing) -> {
            if (existing == null) {
                return new TieredBucket(identity.tier(),
                        Bucket.builder().addLimit(limitFor(identity.tier())).build());
            }
            if (existing.tier() != identity.tier()) {
                existing.bucket().replaceConfiguration(
                        BucketConfiguration.builder().addLimit(limitFor(identity.tier())).build(),
                        TokensInheritanceStrategy.AS_IS);
                return new TieredBucket(identity.tier(), existing.bucket());
            }
            return existing;
        }).bucket();
    }

    private Bandwidth limitFor(Tier tier) {
        int perMinute = requestsPerMinute.forTier(tier);
        return Bandwidth.classic(perMinute, Refill.greedy(perMinute, Duration.ofMinutes(1)));
    }

    private record TieredBucket(Tier tier, Bucket bucket) {}
}
