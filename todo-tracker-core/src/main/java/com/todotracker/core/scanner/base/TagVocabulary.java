package com.todotracker.core.scanner.base;

import com.todotracker.core.model.Tag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The set of tag keywords a scan recognises, supplied by the caller.
 *
 * <p>Built-in and custom tags are matched identically. Matching is exact-case by default;
 * a case-insensitive vocabulary reports each match under the spelling it was declared with.
 */
public final class TagVocabulary {

    /** The five built-in tags. */
    public static final List<String> DEFAULT_TAGS = List.of("TODO", "FIXME", "HACK", "BUG", "XXX");

    private final List<String> tags;
    private final boolean caseSensitive;
    private final Pattern pattern;
    private final Map<String, Tag> byKey;

    private TagVocabulary(Collection<String> tags, boolean caseSensitive) {
        Map<String, Tag> index = new LinkedHashMap<>();
        List<String> names = new ArrayList<>();
        for (String raw : tags) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String name = raw.trim();
            if (index.putIfAbsent(key(name, caseSensitive), Tag.of(name)) == null) {
                names.add(name);
            }
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("tag vocabulary must contain at least one tag");
        }
        this.tags = List.copyOf(names);
        this.caseSensitive = caseSensitive;
        this.byKey = Map.copyOf(index);
        this.pattern = RegexPatterns.tagPattern(this.tags, caseSensitive);
    }

    /**
     * Returns the built-in vocabulary, matched exact-case.
     */
    public static TagVocabulary defaults() {
        return new TagVocabulary(DEFAULT_TAGS, true);
    }

    public static TagVocabulary of(Collection<String> tags, boolean caseSensitive) {
        return new TagVocabulary(tags, caseSensitive);
    }

    /**
     * Returns a vocabulary extending this one with additional tags.
     */
    public TagVocabulary withTags(Collection<String> additional) {
        List<String> merged = new ArrayList<>(tags);
        merged.addAll(additional);
        return new TagVocabulary(merged, caseSensitive);
    }

    private static String key(String text, boolean caseSensitive) {
        return caseSensitive ? text : text.toUpperCase(Locale.ROOT);
    }

    public List<String> tags() {
        return tags;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /**
     * Returns the pattern matching any tag of this vocabulary; group 1 is the tag text.
     */
    public Pattern pattern() {
        return pattern;
    }

    /**
     * Resolves matched text to its declared tag.
     *
     * @param matched text captured by {@link #pattern()}
     * @return declared tag, or empty if the text is not part of the vocabulary
     */
    public Optional<Tag> resolve(String matched) {
        return Optional.ofNullable(byKey.get(key(matched, caseSensitive)));
    }

    @Override
    public String toString() {
        return "TagVocabulary" + tags + (caseSensitive ? "" : " (case-insensitive)");
    }
}
