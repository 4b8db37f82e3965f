package com.todotracker.core.scanner.base;

import com.todotracker.core.model.Priority;

import java.util.regex.Matcher;

/**
 * Parses the parenthetical field group of an annotated tag, e.g. {@code alice, #42, p:high}.
 *
 * <p>Fields are comma-separated and unordered; each is classified on its own:
 * <ul>
 *   <li>{@code #ref} or a tracker key such as {@code ABC-123}: issue reference</li>
 *   <li>{@code p:LEVEL}, a bare level name, or {@code p0}..{@code p3}: priority</li>
 *   <li>an identifier, optionally prefixed with {@code @}: author (first one wins)</li>
 * </ul>
 * Anything else is ignored.
 */
public final class MetadataParser {

    /**
     * Parsed field group. Absent fields are null.
     *
     * @param author author identifier
     * @param issue issue reference without a leading {@code #}
     * @param priority priority level
     */
    public record Metadata(String author, String issue, Priority priority) {

        public static final Metadata EMPTY = new Metadata(null, null, null);
    }

    private MetadataParser() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Classifies every field of a group.
     *
     * @param group text between the parentheses (may be null or empty)
     * @return parsed metadata
     */
    public static Metadata parse(String group) {
        if (group == null || group.isBlank()) {
            return Metadata.EMPTY;
        }

        String author = null;
        String issue = null;
        Priority priority = null;

        for (String rawField : group.split(",")) {
            String field = rawField.trim();
            if (field.isEmpty()) {
                continue;
            }

            Matcher hashIssue = RegexPatterns.HASH_ISSUE_PATTERN.matcher(field);
            if (hashIssue.matches()) {
                issue = hashIssue.group(1);
                continue;
            }
            if (RegexPatterns.ISSUE_KEY_PATTERN.matcher(field).matches()) {
                issue = field;
                continue;
            }

            var level = Priority.fromToken(field);
            if (level.isPresent()) {
                priority = level.get();
                continue;
            }

            Matcher identifier = RegexPatterns.AUTHOR_PATTERN.matcher(field);
            if (identifier.matches() && author == null) {
                author = identifier.group(1);
            }
        }

        return new Metadata(author, issue, priority);
    }
}
