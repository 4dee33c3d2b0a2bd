package com.omniguard.api.crisis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records crisis notifications in the application log. Used when no responder
 * integration is configured.
 */
public class LoggingCrisisResourcesClient implements CrisisResourcesClient {

    private static final Logger log = LoggerFactory.getLogger(LoggingCrisisResourcesClient.class);

    @Override
    public void notify(CrisisNotification notification) {
        log.warn("CRISIS ALERT identity={} severity={} level={} detectedAt={}",
                notification.identityId(), notification.severity(),
                notification.crisisLevel(), notification.detectedAt());
    }
}
