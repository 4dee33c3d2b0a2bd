package com.omniguard.api.config;

import com.omniguard.core.domain.Tier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the message security layer, bound from the {@code omniguard} prefix.
 */
@Validated
@ConfigurationProperties(prefix = "omniguard")
public class OmniGuardProperties {

    @Valid
    private Quota quota = new Quota();
    @Valid
    private Cipher cipher = new Cipher();
    @Valid
    private Audit audit = new Audit();
    @Valid
    private Content content = new Content();
    @Valid
    private Moderation moderation = new Moderation();
    @Valid
    private Throttle throttle = new Throttle();

    public Quota getQuota() { return quota; }
    public void setQuota(Quota quota) { this.quota = quota; }
    public Cipher getCipher() { return cipher; }
    public void setCipher(Cipher cipher) { this.cipher = cipher; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }
    public Content getContent() { return content; }
    public void setContent(Content content) { this.content = content; }
    public Moderation getModeration() { return moderation; }
    public void setModeration(Moderation moderation) { this.moderation = moderation; }
    public Throttle getThrottle() { return throttle; }
    public void setThrottle(Throttle throttle) { this.throttle = throttle; }

    /**
     * Per-tier integer limits.
     */
    public static class TierLimits {
        @Min(0)
        private int guest;
        @Min(0)
        private int free;
        @Min(0)
        private int premium;

        public TierLimits() {
        }

        public TierLimits(int guest, int free, int premium) {
            this.guest = guest;
            this.free = free;
            this.premium = premium;
        }

        public int forTier(Tier tier) {
            return switch (tier) {
                case GUEST -> guest;
                case FREE -> free;
                case PREMIUM -> premium;
            };
        }

        public int getGuest() { return guest; }
        public void setGuest(int guest) { this.guest = guest; }
        public int getFree() { return free; }
        public void setFree(int free) { this.free = free; }
        public int getPremium() { return premium; }
        public void setPremium(int premium) { this.premium = premium; }
    }

    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration baseBackoff = Duration.ofMillis(25);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBaseBackoff() { return baseBackoff; }
        public void setBaseBackoff(Duration baseBackoff) { this.baseBackoff = baseBackoff; }
    }

    public static class Quota {
        @NotBlank
        private String zone = "UTC";
        @Valid
        private TierLimits capacity = new TierLimits(10, 50, 1000);
        @Valid
        private Retry retry = new Retry();
        @Min(1)
        @Max(100)
        private int warningThresholdPercent = 80;
        @NotBlank
        private String purgeCron = "0 15 0 * * *";

        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }
        public TierLimits getCapacity() { return capacity; }
        public void setCapacity(TierLimits capacity) { this.capacity = capacity; }
        public Retry getRetry() { return retry; }
        public void setRetry(Retry retry) { this.retry = retry; }
        public int getWarningThresholdPercent() { return warningThresholdPercent; }
        public void setWarningThresholdPercent(int warningThresholdPercent) { this.warningThresholdPercent = warningThresholdPercent; }
        public String getPurgeCron() { return purgeCron; }
        public void setPurgeCron(String purgeCron) { this.purgeCron = purgeCron; }
    }

    public static class Cipher {
        @NotBlank
        private String initialKeyId = "k1";

        public String getInitialKeyId() { return initialKeyId; }
        public void setInitialKeyId(String initialKeyId) { this.initialKeyId = initialKeyId; }
    }

    public static class Audit {
        @Min(1)
        private int bufferThreshold = 100;
        @Valid
        private Retry retry = new Retry();
        @NotNull
        private Duration flushInterval = Duration.ofSeconds(60);

        public int getBufferThreshold() { return bufferThreshold; }
        public void setBufferThreshold(int bufferThreshold) { this.bufferThreshold = bufferThreshold; }
        public Retry getRetry() { return retry; }
        public void setRetry(Retry retry) { this.retry = retry; }
        public Duration getFlushInterval() { return flushInterval; }
        public void setFlushInterval(Duration flushInterval) { this.flushInterval = flushInterval; }
    }

    public static class Content {
        @Min(1)
        private int maxLength = 1000;
        private List<String> crisisPatterns = new ArrayList<>(List.of(
                "\\b(want|going|plan(ning)?)\\s+to\\s+(die|kill|end|hurt)",
                "\\bsuicid(e|al)\\b",
                "\\bself[\\s-]?harm",
                "\\bcut(ting)?\\s+myself\\b",
                "\\bharm\\s+myself\\b",
                "\\bend\\s+it\\s+all\\b",
                "\\bno\\s+reason\\s+to\\s+live\\b",
                "\\bbetter\\s+off\\s+(dead|gone)\\b"
        ));
        private List<String> extraInjectionPatterns = new ArrayList<>();

        public int getMaxLength() { return maxLength; }
        public void setMaxLength(int maxLength) { this.maxLength = maxLength; }
        public List<String> getCrisisPatterns() { return crisisPatterns; }
        public void setCrisisPatterns(List<String> crisisPatterns) { this.crisisPatterns = crisisPatterns; }
        public List<String> getExtraInjectionPatterns() { return extraInjectionPatterns; }
        public void setExtraInjectionPatterns(List<String> extraInjectionPatterns) { this.extraInjectionPatterns = extraInjectionPatterns; }
    }

    public enum FailurePolicy {
        /** Deliver the message and tag it as unmoderated. */
        FAIL_OPEN,
        /** Block the message. */
        FAIL_CLOSED
    }

    public static class Moderation {
        private boolean enabled = false;
        private String endpoint = "https://api.openai.com/v1/moderations";
        private String apiKey = "";
        @NotNull
        private Duration timeout = Duration.ofSeconds(2);
        @NotNull
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_CLOSED;
        @NotNull
        private Duration cacheTtl = Duration.ofMinutes(5);
        @Min(1)
        private long cacheMaximumSize = 10_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public FailurePolicy getFailurePolicy() { return failurePolicy; }
        public void setFailurePolicy(FailurePolicy failurePolicy) { this.failurePolicy = failurePolicy; }
        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
        public long getCacheMaximumSize() { return cacheMaximumSize; }
        public void setCacheMaximumSize(long cacheMaximumSize) { this.cacheMaximumSize = cacheMaximumSize; }
    }

    public static class Throttle {
        @Valid
        private TierLimits requestsPerMinute = new TierLimits(20, 60, 300);

        public TierLimits getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(TierLimits requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }
    }
}
