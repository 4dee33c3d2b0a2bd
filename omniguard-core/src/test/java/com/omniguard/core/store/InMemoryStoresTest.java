package com.omniguard.core.store;

import com.omniguard.core.domain.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InMemoryStoresTest {

    private static final Instant NOW = Instant.parse("2026-03-14T10:00:00Z");

    // ==================== Quota Buckets ====================

    @Test
    void quotaStore_insertIfAbsentOnlyOnce() {
        InMemoryQuotaBucketStore store = new InMemoryQuotaBucketStore();
        QuotaKey key = new QuotaKey("u1", LocalDate.of(2026, 3, 14));

        assertThat(store.insertIfAbsent(QuotaBucket.fresh(key, 10, NOW))).isTrue();
        assertThat(store.insertIfAbsent(QuotaBucket.fresh(key, 10, NOW))).isFalse();
    }

    @Test
    void quotaStore_compareAndSetRejectsStaleVersion() {
        InMemoryQuotaBucketStore store = new InMemoryQuotaBucketStore();
        QuotaBucket fresh = QuotaBucket.fresh(new QuotaKey("u1", LocalDate.of(2026, 3, 14)), 10, NOW);
        store.insertIfAbsent(fresh);
        QuotaBucket first = fresh.consume(1);

        assertThat(store.compareAndSet(fresh, first)).isTrue();
        assertThat(store.compareAndSet(fresh, fresh.consume(1))).isFalse();
        assertThat(store.find(fresh.key())).contains(first);
    }

    @Test
    void quotaStore_purgesPreviousDays() {
        InMemoryQuotaBucketStore store = new InMemoryQuotaBucketStore();
        store.insertIfAbsent(QuotaBucket.fresh(new QuotaKey("u1", LocalDate.of(2026, 3, 13)), 10, NOW));
        store.insertIfAbsent(QuotaBucket.fresh(new QuotaKey("u1", LocalDate.of(2026, 3, 14)), 10, NOW));

        int purged = store.purgeBefore(LocalDate.of(2026, 3, 14));

        assertThat(purged).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    // ==================== Audit Events ====================

    @Test
    void auditStore_rejectsGapsInSequence() {
        InMemoryAuditEventStore store = new InMemoryAuditEventStore();
        store.append(event(0));

        assertThatThrownBy(() -> store.append(event(2)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.append(event(0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void auditStore_returnsOrderedRangeAndTail() {
        InMemoryAuditEventStore store = new InMemoryAuditEventStore();
        for (int i = 0; i < 5; i++) {
            store.append(event(i));
        }

        assertThat(store.findRange(1, 3)).extracting(AuditEvent::sequenceNumber).containsExactly(1L, 2L, 3L);
        assertThat(store.findTail()).map(AuditEvent::sequenceNumber).contains(4L);
        assertThat(store.count()).isEqualTo(5);
    }

    // ==================== Messages ====================

    @Test
    void messageStore_savesFindsAndDeletes() {
        InMemoryMessageStore store = new InMemoryMessageStore();
        EncryptedEnvelope envelope = new EncryptedEnvelope("k1", new byte[12], new byte[]{9}, new byte[16]);
        store.save(new StoredMessage("m1", "u1", envelope, NOW));

        assertThat(store.find("m1")).map(StoredMessage::envelope).contains(envelope);
        assertThat(store.delete("m1")).isTrue();
        assertThat(store.find("m1")).isEmpty();
    }

    private static AuditEvent event(long sequence) {
        return new AuditEvent(sequence, NOW, "actor", AuditEventType.RECORDED, Map.of("n", String.valueOf(sequence)),
                "payload-" + sequence, "prev-" + sequence, "chain-" + sequence);
    }
}
