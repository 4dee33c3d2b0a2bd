package com.omniguard.core.store;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class BoundedRetryTest {

    private final BoundedRetry retry = new BoundedRetry(3, Duration.ZERO);

    @Test
    void call_returnsFirstSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = retry.call("read", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new PersistenceUnavailableException("down");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void call_rethrowsAfterExhaustingAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.call("read", () -> {
            calls.incrementAndGet();
            throw new PersistenceUnavailableException("down " + calls.get());
        }))
                .isInstanceOf(PersistenceUnavailableException.class)
                .hasMessage("down 3");
        assertThat(calls).hasValue(3);
    }

    @Test
    void call_doesNotRetryOtherExceptions() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.run("write", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("conflict");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void backoff_growsExponentiallyUpToCap() {
        BoundedRetry slow = new BoundedRetry(5, Duration.ofMillis(100));

        assertThat(slow.backoffFor(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(slow.backoffFor(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(slow.backoffFor(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(slow.backoffFor(10)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void constructor_rejectsZeroAttempts() {
        assertThatThrownBy(() -> new BoundedRetry(0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
