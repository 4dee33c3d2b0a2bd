package com.omniguard.api.crisis;

import com.omniguard.core.domain.Identity;
import com.omniguard.core.domain.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands crisis notifications to crisis resources without holding up message delivery.
 */
@Service
public class CrisisEscalationService {

    private static final Logger log = LoggerFactory.getLogger(CrisisEscalationService.class);

    private final CrisisResourcesClient client;
    private final Executor executor;
    private final Clock clock;

    public CrisisEscalationService(CrisisResourcesClient client,
                                   @Qualifier("crisisExecutor") Executor executor,
                                   Clock clock) {
        this.client = Objects.requireNonNull(client, "Client cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Schedules one notification. Returns immediately; delivery failures are logged.
     */
    public CrisisNotification escalate(Identity identity, Severity severity) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        if (!severity.isCrisis()) {
            throw new IllegalArgumentException("Cannot escalate without a crisis severity");
        }
        CrisisNotification notification =
                new CrisisNotification(identity.id(), clock.instant(), severity, severity.crisisLevel());
        log.warn("Escalating crisis for identity {} at severity {}", identity.id(), severity);
        try {
            executor.execute(() -> deliver(notification));
        } catch (RejectedExecutionException e) {
            log.error("Crisis executor rejected notification, delivering inline", e);
            deliver(notification);
        }
        return notification;
    }

    private void deliver(CrisisNotification notification) {
        try {
            client.notify(notification);
        } catch (RuntimeException e) {
            log.error("Crisis notification for identity {} could not be delivered", notification.identityId(), e);
        }
    }
}
