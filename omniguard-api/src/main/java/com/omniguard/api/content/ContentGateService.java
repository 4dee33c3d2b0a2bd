package com.omniguard.api.content;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.omniguard.api.config.OmniGuardProperties;
import com.omniguard.api.config.OmniGuardProperties.FailurePolicy;
import com.omniguard.core.domain.ContentReason;
import com.omniguard.core.domain.ModerationVerdict;
import com.omniguard.core.domain.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Decides whether a message may be sent.
 * <p>
 * Checks run in order: normalization, injection filtering (blocks), crisis detection
 * (never blocks), a suspicious-content heuristic (never blocks) and, when enabled, the
 * external moderation service bounded by a timeout. A moderation failure is resolved by
 * the configured {@link FailurePolicy}. Moderation flags that only concern self-harm are
 * treated as crisis signals rather than grounds to block.
 */
@Service
public class ContentGateService {

    private static final Logger log = LoggerFactory.getLogger(ContentGateService.class);

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern WORD_SPLIT = Pattern.compile("\\s+");

    // Suspicious-content thresholds
    private static final double MAX_UPPERCASE_RATIO = 0.8;
    private static final double MAX_SPECIAL_CHAR_RATIO = 0.5;
    private static final int MIN_LETTERS_FOR_CASE_CHECK = 10;
    private static final int MIN_WORDS_FOR_REPETITION_CHECK = 10;

    private final InjectionFilter injectionFilter;
    private final CrisisDetector crisisDetector;
    private final ModerationClient moderationClient;
    private final Executor moderationExecutor;
    private final int maxLength;
    private final boolean moderationEnabled;
    private final Duration moderationTimeout;
    private final FailurePolicy failurePolicy;
    private final Cache<String, ModerationClient.ModerationResult> moderationCache;

    public ContentGateService(OmniGuardProperties properties,
                              ModerationClient moderationClient,
                              @Qualifier("moderationExecutor") Executor moderationExecutor,
                              Clock clock) {
        OmniGuardProperties.Content content = properties.getContent();
        OmniGuardProperties.Moderation moderation = properties.getModeration();
        this.injectionFilter = new InjectionFilter(content.getExtraInjectionPatterns());
        this.crisisDetector = new CrisisDetector(content.getCrisisPatterns());
        this.moderationClient = Objects.requireNonNull(moderationClient, "Moderation client cannot be null");
        this.moderationExecutor = Objects.requireNonNull(moderationExecutor, "Executor cannot be null");
        Objects.requireNonNull(clock, "Clock cannot be null");
        this.maxLength = content.getMaxLength();
        this.moderationEnabled = moderation.isEnabled();
        this.moderationTimeout = moderation.getTimeout();
        this.failurePolicy = moderation.getFailurePolicy();
        this.moderationCache = Caffeine.newBuilder()
                .maximumSize(moderation.getCacheMaximumSize())
                .expireAfterWrite(moderation.getCacheTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Validates a message. Never throws for content reasons; the verdict carries the outcome.
     */
    public ModerationVerdict validate(String text) {
        String sanitized = sanitize(text);
        if (sanitized.isEmpty()) {
            return ModerationVerdict.blocked(ContentReason.EMPTY_MESSAGE);
        }

        Set<ContentReason> reasons = EnumSet.noneOf(ContentReason.class);
        if (sanitized.length() > maxLength) {
            sanitized = sanitized.substring(0, maxLength);
            reasons.add(ContentReason.TRUNCATED);
        }

        Optional<InjectionFilter.InjectionMatch> injection = injectionFilter.detect(sanitized);
        if (injection.isPresent()) {
            log.warn("Blocked message with {} injection pattern", injection.get().kind());
            reasons.add(ContentReason.INJECTION_DETECTED);
            return ModerationVerdict.blocked(reasons, Severity.NONE,
                    List.of("injection:" + injection.get().kind().name().toLowerCase(Locale.ROOT)));
        }

        Severity severity = crisisDetector.assess(sanitized);
        List<String> categories = new ArrayList<>();
        if (isSuspicious(sanitized)) {
            reasons.add(ContentReason.SUSPICIOUS_CONTENT);
        }

        if (moderationEnabled) {
            Optional<ModerationClient.ModerationResult> moderation = moderate(sanitized);
            if (moderation.isEmpty()) {
                reasons.add(ContentReason.MODERATION_UNAVAILABLE);
                if (failurePolicy == FailurePolicy.FAIL_CLOSED) {
                    log.warn("Moderation unavailable, blocking under fail-closed policy");
                    return ModerationVerdict.blocked(withCrisis(reasons, severity), severity, categories);
                }
                log.warn("Moderation unavailable, allowing under fail-open policy");
            } else if (moderation.get().flagged()) {
                List<String> flagged = moderation.get().categories();
                List<String> selfHarm = flagged.stream().filter(ContentGateService::isSelfHarmCategory).toList();
                categories.addAll(flagged);
                if (!selfHarm.isEmpty()) {
                    severity = severity.max(Severity.HIGH);
                }
                if (selfHarm.size() < flagged.size() || flagged.isEmpty()) {
                    log.warn("Moderation flagged message in categories {}", flagged);
                    reasons.add(ContentReason.MODERATION_FLAGGED);
                    return ModerationVerdict.blocked(withCrisis(reasons, severity), severity, categories);
                }
            }
        }

        if (severity.isCrisis()) {
            log.warn("Crisis language detected, severity {}", severity);
        }
        return ModerationVerdict.allowed(sanitized, withCrisis(reasons, severity), severity, categories);
    }

    /**
     * Strips control characters, collapses whitespace runs and trims.
     */
    static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String stripped = CONTROL_CHARS.matcher(text).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Heavy shouting, mostly symbols or heavily repeated words.
     */
    static boolean isSuspicious(String text) {
        long letters = text.chars().filter(Character::isLetter).count();
        long upper = text.chars().filter(Character::isUpperCase).count();
        if (letters > MIN_LETTERS_FOR_CASE_CHECK && (double) upper / letters > MAX_UPPERCASE_RATIO) {
            return true;
        }

        long special = text.chars().filter(c -> !Character.isLetterOrDigit(c) && !Character.isWhitespace(c)).count();
        if (!text.isEmpty() && (double) special / text.length() > MAX_SPECIAL_CHAR_RATIO) {
            return true;
        }

        String[] words = WORD_SPLIT.split(text.toLowerCase(Locale.ROOT));
        if (words.length > MIN_WORDS_FOR_REPETITION_CHECK) {
            long unique = Arrays.stream(words).distinct().count();
            return unique < words.length / 4;
        }
        return false;
    }

    private Optional<ModerationClient.ModerationResult> moderate(String text) {
        String cacheKey = sha256(text);
        ModerationClient.ModerationResult cached = moderationCache.getIfPresent(cacheKey);
        if (cached != null) {
            return Optional.of(cached);
        }

        CompletableFuture<ModerationClient.ModerationResult> call =
                CompletableFuture.supplyAsync(() -> moderationClient.moderate(text), moderationExecutor);
        try {
            ModerationClient.ModerationResult result = call.get(moderationTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                log.warn("Moderation service returned no result");
                return Optional.empty();
            }
            moderationCache.put(cacheKey, result);
            return Optional.of(result);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Moderation service timed out after {} ms", moderationTimeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Moderation service failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for moderation");
            return Optional.empty();
        }
    }

    long cachedModerationCount() {
        moderationCache.cleanUp();
        return moderationCache.estimatedSize();
    }

    private static Set<ContentReason> withCrisis(Set<ContentReason> reasons, Severity severity) {
        if (severity.isCrisis()) {
            reasons.add(ContentReason.CRISIS_DETECTED);
        }
        return reasons;
    }

    private static boolean isSelfHarmCategory(String category) {
        return category.toLowerCase(Locale.ROOT).replace('_', '-').startsWith("self-harm");
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
