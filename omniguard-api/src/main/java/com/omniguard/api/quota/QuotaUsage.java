package com.omniguard.api.quota;

import com.omniguard.core.domain.Tier;

import java.time.Instant;

/**
 * Read-only snapshot of an identity's allowance for today.
 */
public record QuotaUsage(
        String identityId,
        Tier tier,
        int capacity,
        int used,
        int remaining,
        Instant resetAt,
        boolean nearLimit
) {}
