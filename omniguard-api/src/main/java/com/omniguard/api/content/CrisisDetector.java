package com.omniguard.api.content;

import com.omniguard.core.domain.Severity;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Recognizes crisis and self-harm language.
 * Explicit statements of intent rate {@link Severity#CRITICAL}; otherwise severity grows
 * with the number of distinct configured patterns that match.
 */
public class CrisisDetector {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> INTENT_PATTERNS = List.of(
            Pattern.compile("\\b(want|going|plan(ning)?)\\s+to\\s+(die|kill\\s+myself|end\\s+(it|my\\s+life)|hurt\\s+myself)\\b", FLAGS),
            Pattern.compile("\\bkill\\s+myself\\b", FLAGS),
            Pattern.compile("\\bend\\s+my\\s+life\\b", FLAGS)
    );

    private final List<Pattern> patterns;

    public CrisisDetector(List<String> patterns) {
        Objects.requireNonNull(patterns, "Patterns cannot be null");
        this.patterns = patterns.stream()
                .map(regex -> Pattern.compile(regex, FLAGS))
                .toList();
    }

    public Severity assess(String text) {
        if (text == null || text.isBlank()) {
            return Severity.NONE;
        }
        for (Pattern intent : INTENT_PATTERNS) {
            if (intent.matcher(text).find()) {
                return Severity.CRITICAL;
            }
        }
        long matches = patterns.stream().filter(p -> p.matcher(text).find()).count();
        if (matches >= 2) {
            return Severity.HIGH;
        }
        return matches == 1 ? Severity.MEDIUM : Severity.NONE;
    }
}
