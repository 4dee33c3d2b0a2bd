package com.omniguard.core.store;

import com.omniguard.core.domain.AuditEvent;

import java.util.List;
import java.util.Optional;

/**
 * Append-only persistence port for audit events.
 */
public interface AuditEventStore {

    /**
     * Appends an event at the tail. The store rejects events whose sequence number is not
     * exactly one past the current tail.
     *
     * @throws IllegalStateException if the sequence number does not extend the tail
     * @throws PersistenceUnavailableException if the store cannot be reached
     */
    void append(AuditEvent event);

    Optional<AuditEvent> findTail();

    /**
     * Returns stored events with sequence numbers in {@code [from, to]}, ordered by sequence number.
     */
    List<AuditEvent> findRange(long from, long to);

    long count();
}
