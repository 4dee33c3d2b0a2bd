package com.omniguard.api.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pattern filter for injection payloads hidden in chat text: SQL, script markup,
 * shell commands, path traversal and attempts to override the assistant's instructions.
 */
public class InjectionFilter {

    public enum InjectionKind {
        SQL,
        SCRIPT,
        COMMAND,
        PATH_TRAVERSAL,
        PROMPT,
        CUSTOM
    }

    public record InjectionMatch(InjectionKind kind, String pattern) {}

    private record Rule(InjectionKind kind, Pattern pattern) {}

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Rule> BUILT_IN_RULES = List.of(
            // SQL
            rule(InjectionKind.SQL, "'\\s*;?\\s*(drop|delete|truncate|alter|insert|update)\\s+(table|from|into|database)\\b"),
            rule(InjectionKind.SQL, ";\\s*(drop|truncate|alter)\\s+(table|database)\\b"),
            rule(InjectionKind.SQL, "\\bunion\\s+(all\\s+)?select\\b"),
            rule(InjectionKind.SQL, "'\\s*or\\s+'?\\d+'?\\s*=\\s*'?\\d+"),
            rule(InjectionKind.SQL, "'\\s*;?\\s*--\\s*$"),
            // Script markup
            rule(InjectionKind.SCRIPT, "<\\s*script\\b"),
            rule(InjectionKind.SCRIPT, "<\\s*/\\s*script\\s*>"),
            rule(InjectionKind.SCRIPT, "javascript\\s*:"),
            rule(InjectionKind.SCRIPT, "<[^>]*\\bon\\w+\\s*="),
            rule(InjectionKind.SCRIPT, "<\\s*(iframe|object|embed)\\b"),
            // Shell, only when the command takes a flag, path or URL
            rule(InjectionKind.COMMAND, "(;|&&|\\|\\|?)\\s*(rm|curl|wget|chmod|bash|sh|nc)\\s+(-\\w|/|~/|https?://|\\S+\\.\\S+)"),
            rule(InjectionKind.COMMAND, "\\$\\([^)]*\\)"),
            rule(InjectionKind.COMMAND, "`\\s*(rm|curl|wget|cat|bash|sh)\\b[^`]*`"),
            // Path traversal
            rule(InjectionKind.PATH_TRAVERSAL, "\\.\\.[/\\\\]"),
            rule(InjectionKind.PATH_TRAVERSAL, "%2e%2e(%2f|%5c|/|\\\\)"),
            rule(InjectionKind.PATH_TRAVERSAL, "/etc/(passwd|shadow)\\b"),
            // Prompt override
            rule(InjectionKind.PROMPT, "\\[(system|assistant|user)\\]"),
            rule(InjectionKind.PROMPT, "\\bignore\\s+(all\\s+)?(previous|prior|above)\\s+(instructions|prompts)\\b"),
            rule(InjectionKind.PROMPT, "\\bforget\\s+everything\\s+above\\b"),
            rule(InjectionKind.PROMPT, "\\bdisregard\\s+all\\s+prior\\s+(commands|instructions)\\b"),
            rule(InjectionKind.PROMPT, "\\bnew\\s+instructions\\s*:"),
            rule(InjectionKind.PROMPT, "\\byou\\s+are\\s+now\\s+a\\b"),
            rule(InjectionKind.PROMPT, "\\broleplay\\s+as\\s+an?\\b"),
            rule(InjectionKind.PROMPT, "\\bsimulate\\s+being\\s+a\\b"),
            rule(InjectionKind.PROMPT, "\\bbypass\\s+your\\s+safety\\b"),
            rule(InjectionKind.PROMPT, "\\boverride\\s+your\\s+restrictions\\b"),
            rule(InjectionKind.PROMPT, "\\bjailbreak\\s+mode\\b"),
            rule(InjectionKind.PROMPT, "\\bDAN\\s+mode\\b"),
            rule(InjectionKind.PROMPT, "\\bdeveloper\\s+mode\\s+enabled\\b")
    );

    private final List<Rule> rules;

    public InjectionFilter() {
        this(List.of());
    }

    /**
     * @param extraPatterns additional case-insensitive patterns, reported as {@link InjectionKind#CUSTOM}
     */
    public InjectionFilter(List<String> extraPatterns) {
        Objects.requireNonNull(extraPatterns, "Extra patterns cannot be null");
        List<Rule> all = new ArrayList<>(BUILT_IN_RULES);
        for (String pattern : extraPatterns) {
            all.add(rule(InjectionKind.CUSTOM, pattern));
        }
        this.rules = List.copyOf(all);
    }

    /**
     * Returns the first rule the text trips, if any.
     */
    public Optional<InjectionMatch> detect(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (Rule rule : rules) {
            if (rule.pattern().matcher(text).find()) {
                return Optional.of(new InjectionMatch(rule.kind(), rule.pattern().pattern()));
            }
        }
        return Optional.empty();
    }

    private static Rule rule(InjectionKind kind, String regex) {
        return new Rule(kind, Pattern.compile(regex, FLAGS));
    }
}
