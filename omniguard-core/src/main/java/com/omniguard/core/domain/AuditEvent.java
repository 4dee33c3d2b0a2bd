package com.omniguard.core.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One link of the hash-chained audit log.
 * <p>
 * {@code chainHash = SHA-256(prevChainHash | payloadHash | timestamp | actor)} and the
 * first event chains from the genesis hash. The payload never carries message plaintext.
 */
public record AuditEvent(
        long sequenceNumber,
        Instant timestamp,
        String actor,
        AuditEventType eventType,
        Map<String, String> payload,
        String payloadHash,
        String prevChainHash,
        String chainHash
) {

    public AuditEvent {
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("Sequence number cannot be negative");
        }
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        Objects.requireNonNull(actor, "Actor cannot be null");
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(payloadHash, "Payload hash cannot be null");
        Objects.requireNonNull(prevChainHash, "Previous chain hash cannot be null");
        Objects.requireNonNull(chainHash, "Chain hash cannot be null");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
