package com.todotracker.core.scanner.base;

import java.util.Collection;
import java.util.Comparator;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shared regex patterns for tag and metadata recognition.
 *
 * <p>Field patterns are compiled once at class loading time. Tag patterns depend on the
 * caller's vocabulary and are built through {@link #tagPattern(Collection, boolean)}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Pattern tags = RegexPatterns.tagPattern(List.of("TODO", "FIXME"), true);
 * Matcher m = tags.matcher(" TODO(alice): fix");
 * m.find(); // m.group(1) == "TODO"
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RegexPatterns {

    /** Issue reference written with a hash: {@code #42}, {@code #issue-slug}. */
    public static final Pattern HASH_ISSUE_PATTERN =
        Pattern.compile("#([\\w][\\w.\\-/]*)");

    /** Tracker-style issue key: {@code ABC-123}. */
    public static final Pattern ISSUE_KEY_PATTERN =
        Pattern.compile("[A-Z][A-Z0-9]+-\\d+");

    /** Author identifier, optionally prefixed with {@code @}: {@code alice}, {@code @j.doe}. */
    public static final Pattern AUTHOR_PATTERN =
        Pattern.compile("@?([\\p{L}_][\\p{L}\\p{N}_.\\-]*)");

    private RegexPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Builds the pattern matching any tag in a vocabulary as a standalone word.
     *
     * <p>Group 1 captures the tag text. Word boundaries are expressed as lookarounds on word
     * characters so tags containing punctuation (e.g. {@code @todo}) still match.
     * Alternatives are ordered longest first.
     *
     * @param tags tag names
     * @param caseSensitive whether matching is exact-case
     * @return compiled pattern
     */
    public static Pattern tagPattern(Collection<String> tags, boolean caseSensitive) {
        if (tags.isEmpty()) {
            throw new IllegalArgumentException("tag vocabulary must not be empty");
        }
        String alternatives = tags.stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        String regex = "(?<![\\p{L}\\p{N}_])(" + alternatives + ")(?![\\p{L}\\p{N}_])";
        int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        return Pattern.compile(regex, flags);
    }
}
