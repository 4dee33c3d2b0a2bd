package com.omniguard.api.audit;

/**
 * Result of walking a range of the audit chain.
 *
 * @param valid             true if every event in the range links correctly
 * @param eventsVerified    number of events checked before stopping
 * @param firstBadSequence  first sequence number that failed, or -1 when valid
 * @param problem           what failed at {@code firstBadSequence}, or null when valid
 */
public record ChainVerification(boolean valid, long eventsVerified, long firstBadSequence, String problem) {

    public static ChainVerification intact(long eventsVerified) {
        return new ChainVerification(true, eventsVerified, -1, null);
    }

    public static ChainVerification tampered(long eventsVerified, long firstBadSequence, String problem) {
        return new ChainVerification(false, eventsVerified, firstBadSequence, problem);
    }
}
