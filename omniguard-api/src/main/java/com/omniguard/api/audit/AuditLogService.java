package com.omniguard.api.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.omniguard.api.config.OmniGuardProperties;
import com.omniguard.core.domain.AuditEvent;
import com.omniguard.core.domain.AuditEventType;
import com.omniguard.core.store.AuditEventStore;
import com.omniguard.core.store.BoundedRetry;
import com.omniguard.core.store.PersistenceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Append-only, hash-chained audit log.
 * <p>
 * Appends are serialized: each event takes the next sequence number and chains from the
 * previous event's hash. Events the store does not accept are held in an in-memory buffer
 * and flushed in order; once that buffer reaches its threshold further appends fail
 * closed with {@link AuditUnavailableException}. Detected tampering freezes the log until
 * an operator clears it.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    // Hashing uses its own mapper so application JSON settings cannot change stored hashes.
    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private final AuditEventStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final BoundedRetry retry;
    private final BoundedRetry singleAttempt = new BoundedRetry(1, Duration.ZERO);
    private final int bufferThreshold;

    private final Deque<AuditEvent> pending = new ArrayDeque<>();
    private long nextSequence;
    private String lastChainHash;
    private volatile boolean frozen;
    private volatile ChainVerification freezeCause;

    public AuditLogService(AuditEventStore store, ObjectMapper objectMapper,
                           OmniGuardProperties properties, Clock clock) {
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        OmniGuardProperties.Audit audit = properties.getAudit();
        this.bufferThreshold = audit.getBufferThreshold();
        this.retry = new BoundedRetry(audit.getRetry().getMaxAttempts(), audit.getRetry().getBaseBackoff());

        AuditEvent tail = retry.call("audit tail read", store::findTail).orElse(null);
        this.nextSequence = tail == null ? 0 : tail.sequenceNumber() + 1;
        this.lastChainHash = tail == null ? GENESIS_HASH : tail.chainHash();
        if (tail != null) {
            log.info("Audit log resumed at sequence {}", nextSequence);
        }
    }

    /**
     * Appends an event and returns its sequence number.
     *
     * @throws AuditLogFrozenException if tampering was detected and not yet cleared
     * @throws AuditUnavailableException if the store is down and the buffer is full
     */
    public synchronized long append(String actor, AuditEventType eventType, Map<String, String> payload) {
        Objects.requireNonNull(actor, "Actor cannot be null");
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Map<String, String> safePayload = payload == null ? Map.of() : payload;
        if (frozen) {
            throw new AuditLogFrozenException(freezeCause);
        }

        // With a backlog the store is likely down: one attempt, no backoff, while holding the lock.
        boolean storeReachable = pending.isEmpty() || flushPendingLocked(singleAttempt);
        if (pending.size() >= bufferThreshold) {
            log.error("Audit buffer full ({} events pending), rejecting {} event", pending.size(), eventType);
            throw new AuditUnavailableException(
                    "Audit store unavailable with " + pending.size() + " events pending");
        }

        Instant timestamp = clock.instant();
        String payloadHash = payloadHash(eventType, safePayload);
        String chainHash = chainHash(lastChainHash, payloadHash, timestamp, actor);
        AuditEvent event = new AuditEvent(nextSequence, timestamp, actor, eventType, safePayload,
                payloadHash, lastChainHash, chainHash);

        pending.addLast(event);
        lastChainHash = chainHash;
        nextSequence++;
        if (storeReachable) {
            flushPendingLocked(retry);
        }
        return event.sequenceNumber();
    }

    /**
     * Retries buffered events with backoff. Runs on a schedule; appends make a single attempt.
     */
    @Scheduled(fixedDelayString = "${omniguard.audit.flush-interval:PT60S}")
    public synchronized void flushPending() {
        flushPendingLocked(retry);
    }

    private boolean flushPendingLocked(BoundedRetry policy) {
        while (!pending.isEmpty()) {
            AuditEvent next = pending.peekFirst();
            try {
                policy.run("audit append", () -> store.append(next));
            } catch (PersistenceUnavailableException e) {
                log.warn("Audit store unavailable, {} events buffered", pending.size());
                return false;
            }
            pending.removeFirst();
        }
        return true;
    }

    /**
     * Verifies every persisted event.
     */
    public ChainVerification verifyIntegrity() {
        long persistedTail;
        synchronized (this) {
            persistedTail = nextSequence - pending.size() - 1;
        }
        return verifyIntegrity(0, persistedTail);
    }

    /**
     * Walks {@code [from, to]} recomputing payload and chain hashes. The first event in the
     * range is anchored to the stored hash of its predecessor. Any gap, reordering or
     * altered field is reported at the first sequence number where the chain breaks, and
     * freezes the log.
     */
    public ChainVerification verifyIntegrity(long from, long to) {
        if (from < 0 || to < from) {
            return ChainVerification.intact(0);
        }
        long persistedTail;
        synchronized (this) {
            persistedTail = nextSequence - pending.size() - 1;
        }
        long upper = Math.min(to, persistedTail);
        if (upper < from) {
            return ChainVerification.intact(0);
        }

        String expectedPrev = GENESIS_HASH;
        if (from > 0) {
            List<AuditEvent> anchor = retry.call("audit read", () -> store.findRange(from - 1, from - 1));
            if (anchor.isEmpty() || anchor.get(0).sequenceNumber() != from - 1) {
                return freeze(ChainVerification.tampered(0, from - 1, "Anchor event missing"));
            }
            expectedPrev = anchor.get(0).chainHash();
        }

        List<AuditEvent> events = retry.call("audit read", () -> store.findRange(from, upper));
        long expectedSequence = from;
        long verified = 0;
        for (AuditEvent event : events) {
            if (event.sequenceNumber() != expectedSequence) {
                return freeze(ChainVerification.tampered(verified, expectedSequence, "Event missing or out of order"));
            }
            if (!event.prevChainHash().equals(expectedPrev)) {
                return freeze(ChainVerification.tampered(verified, expectedSequence, "Previous hash does not link"));
            }
            if (!payloadHash(event.eventType(), event.payload()).equals(event.payloadHash())) {
                return freeze(ChainVerification.tampered(verified, expectedSequence, "Payload hash mismatch"));
            }
            String recomputed = chainHash(expectedPrev, event.payloadHash(), event.timestamp(), event.actor());
            if (!recomputed.equals(event.chainHash())) {
                return freeze(ChainVerification.tampered(verified, expectedSequence, "Chain hash mismatch"));
            }
            expectedPrev = recomputed;
            expectedSequence++;
            verified++;
        }
        if (expectedSequence <= upper) {
            return freeze(ChainVerification.tampered(verified, expectedSequence, "Event missing"));
        }
        return ChainVerification.intact(verified);
    }

    /**
     * Like {@link #verifyIntegrity(long, long)} but throws on the first broken link.
     */
    public void requireIntegrity(long from, long to) {
        ChainVerification result = verifyIntegrity(from, to);
        if (!result.valid()) {
            throw new TamperDetectedException(result);
        }
    }

    /**
     * Clears a freeze after an operator has investigated. The clearance is itself audited.
     */
    public synchronized long unfreeze(String operator) {
        if (!frozen) {
            throw new IllegalStateException("Audit log is not frozen");
        }
        ChainVerification cause = freezeCause;
        frozen = false;
        freezeCause = null;
        log.warn("Audit log unfrozen by {} (was frozen at sequence {})", operator, cause.firstBadSequence());
        return append(operator, AuditEventType.AUDIT_UNFROZEN, Map.of(
                "firstBadSequence", String.valueOf(cause.firstBadSequence()),
                "problem", cause.problem()));
    }

    /**
     * Exports all persisted events as JSON.
     */
    public String exportAsJson() {
        long persistedTail;
        synchronized (this) {
            persistedTail = nextSequence - pending.size() - 1;
        }
        List<AuditEvent> events = persistedTail < 0
                ? List.of()
                : retry.call("audit read", () -> store.findRange(0, persistedTail));
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("exportedAt", clock.instant().toString());
        export.put("entryCount", events.size());
        export.put("entries", events);
        try {
            return objectMapper.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export audit log", e);
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized long nextSequence() {
        return nextSequence;
    }

    private ChainVerification freeze(ChainVerification result) {
        if (!frozen) {
            freezeCause = result;
            frozen = true;
        }
        log.error("Audit chain broken at sequence {}: {}. Log frozen.", result.firstBadSequence(), result.problem());
        return result;
    }

    String payloadHash(AuditEventType eventType, Map<String, String> payload) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("type", eventType.name());
        canonical.put("payload", new TreeMap<>(payload));
        try {
            return sha256(CANONICAL_MAPPER.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit payload", e);
        }
    }

    static String chainHash(String prevChainHash, String payloadHash, Instant timestamp, String actor) {
        return sha256(prevChainHash + "|" + payloadHash + "|" + timestamp + "|" + actor);
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * The audit log cannot accept events; callers must fail closed.
     */
    public static class AuditUnavailableException extends RuntimeException {
        public AuditUnavailableException(String message) { super(message); }
    }

    public static class AuditLogFrozenException extends AuditUnavailableException {
        private final ChainVerification verification;

        public AuditLogFrozenException(ChainVerification verification) {
            super("Audit log frozen after tampering at sequence " + verification.firstBadSequence());
            this.verification = verification;
        }

        public ChainVerification verification() {
            return verification;
        }
    }

    public static class TamperDetectedException extends RuntimeException {
        private final ChainVerification verification;

        public TamperDetectedException(ChainVerification verification) {
            super("Audit chain broken at sequence " + verification.firstBadSequence() + ": " + verification.problem());
            this.verification = verification;
        }

        public ChainVerification verification() {
            return verification;
        }
    }
}
