package com.omniguard.api.crisis;

import com.omniguard.api.support.MutableClock;
import com.omniguard.core.domain.Identity;
import com.omniguard.core.domain.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.*;

class CrisisEscalationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-14T22:15:00Z");

    private final List<CrisisNotification> received = new CopyOnWriteArrayList<>();
    private final CrisisResourcesClient recordingClient = received::add;
    private final Executor direct = Runnable::run;

    @Test
    void escalate_deliversIdentityTimestampAndSeverity() {
        CrisisEscalationService service = new CrisisEscalationService(recordingClient, direct, new MutableClock(NOW));

        service.escalate(Identity.guest("user-9"), Severity.HIGH);

        assertThat(received).containsExactly(new CrisisNotification("user-9", NOW, Severity.HIGH, 8));
    }

    @Test
    void deliveryFailure_doesNotReachCaller() {
        CrisisResourcesClient failing = notification -> {
            throw new IllegalStateException("hotline API down");
        };
        CrisisEscalationService service = new CrisisEscalationService(failing, direct, new MutableClock(NOW));

        assertThatCode(() -> service.escalate(Identity.guest("user-9"), Severity.CRITICAL))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectedExecutor_deliversInline() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };
        CrisisEscalationService service = new CrisisEscalationService(recordingClient, saturated, new MutableClock(NOW));

        service.escalate(Identity.guest("user-9"), Severity.MEDIUM);

        assertThat(received).hasSize(1);
    }

    @Test
    void escalate_requiresCrisisSeverity() {
        CrisisEscalationService service = new CrisisEscalationService(recordingClient, direct, new MutableClock(NOW));

        assertThatThrownBy(() -> service.escalate(Identity.guest("user-9"), Severity.NONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(received).isEmpty();
    }
}
