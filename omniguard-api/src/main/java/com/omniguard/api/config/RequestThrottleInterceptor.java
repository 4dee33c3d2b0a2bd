package com.omniguard.api.config;

import com.omniguard.core.domain.Identity;
import com.omniguard.core.domain.Tier;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects bursts on the message endpoints with 429 before the pipeline runs.
 */
@Component
public class RequestThrottleInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RequestThrottleInterceptor.class);

    private final RequestThrottleConfig throttleConfig;

    public RequestThrottleInterceptor(RequestThrottleConfig throttleConfig) {
        this.throttleConfig = throttleConfig;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                             Object handler) throws Exception {

        String identityId = request.getHeader(IdentityHeaderFilter.IDENTITY_HEADER);
        if (identityId == null || identityId.isBlank()) {
            // Unauthenticated requests are rejected by the security chain.
            return true;
        }
        Identity identity = Identity.of(identityId, Tier.fromName(request.getHeader(IdentityHeaderFilter.TIER_HEADER)));
        Bucket bucket = throttleConfig.resolveBucket(identity);

        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (probe.isConsumed()) {
            response.addHeader("X-Rate-Limit-Remaining", String.valueOf(probe.getRemainingTokens()));
            return true;
        }

        long waitForRefill = Math.max(1, probe.getNanosToWaitForRefill() / 1_000_000_000);
        log.warn("Request throttled for identity {}, retry after {}s", identity.id(), waitForRefill);
        response.addHeader("X-Rate-Limit-Retry-After-Seconds", String.valueOf(waitForRefill));
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"code\":\"THROTTLE_001\",\"message\":\"Too many requests. Retry after "
                + waitForRefill + " seconds.\"}");
        return false;
    }
}
