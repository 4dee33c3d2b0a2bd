package com.omniguard.core.store;

import com.omniguard.core.domain.AuditEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Audit event store held in a sorted map.
 * Besides the port operations it exposes {@link #overwrite} and {@link #remove}
 * so integrity checks can be exercised against a tampered log.
 */
public class InMemoryAuditEventStore implements AuditEventStore {

    private final ConcurrentSkipListMap<Long, AuditEvent> events = new ConcurrentSkipListMap<>();
    private long nextSequence = 0;

    @Override
    public synchronized void append(AuditEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        if (event.sequenceNumber() != nextSequence) {
            throw new IllegalStateException("Expected sequence " + nextSequence
                    + " but got " + event.sequenceNumber());
        }
        events.put(event.sequenceNumber(), event);
        nextSequence++;
    }

    @Override
    public Optional<AuditEvent> findTail() {
        Map.Entry<Long, AuditEvent> last = events.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    @Override
    public List<AuditEvent> findRange(long from, long to) {
        if (from > to) {
            return List.of();
        }
        return new ArrayList<>(events.subMap(from, true, to, true).values());
    }

    @Override
    public long count() {
        return events.size();
    }

    /**
     * Replaces a stored event in place, bypassing the append-only rule.
     */
    public void overwrite(AuditEvent event) {
        events.put(event.sequenceNumber(), event);
    }

    /**
     * Deletes a stored event, bypassing the append-only rule.
     */
    public void remove(long sequenceNumber) {
        events.remove(sequenceNumber);
    }
}
