package com.omniguard.api.crisis;

import com.omniguard.core.domain.Severity;

import java.time.Instant;

/**
 * What crisis responders receive. Carries no message content.
 */
public record CrisisNotification(String identityId, Instant detectedAt, Severity severity, int crisisLevel) {}
