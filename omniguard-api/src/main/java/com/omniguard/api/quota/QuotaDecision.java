package com.omniguard.api.quota;

import java.time.Instant;

/**
 * Result of a quota check.
 *
 * @param allowed   whether tokens were consumed
 * @param remaining tokens left after this decision
 * @param resetAt   when the allowance next resets; null when the store was unavailable
 * @param outcome   granted, exhausted, or store unavailable
 */
public record QuotaDecision(boolean allowed, int remaining, Instant resetAt, Outcome outcome) {

    public enum Outcome {
        GRANTED,
        QUOTA_EXCEEDED,
        STORE_UNAVAILABLE
    }

    public static QuotaDecision granted(int remaining, Instant resetAt) {
        return new QuotaDecision(true, remaining, resetAt, Outcome.GRANTED);
    }

    public static QuotaDecision exceeded(int remaining, Instant resetAt) {
        return new QuotaDecision(false, remaining, resetAt, Outcome.QUOTA_EXCEEDED);
    }

    public static QuotaDecision unavailable() {
        return new QuotaDecision(false, 0, null, Outcome.STORE_UNAVAILABLE);
    }
}
