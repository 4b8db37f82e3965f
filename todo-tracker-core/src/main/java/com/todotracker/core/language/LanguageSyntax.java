package com.todotracker.core.language;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Comment syntax of one programming language.
 *
 * <p>Block comments are assumed not to nest: the first close delimiter after an open
 * delimiter terminates the comment.
 *
 * @param name display name (e.g. "Java", "C++")
 * @param extensions lower-case file extensions without the dot
 * @param lineComment line-comment marker, or null if the language has none
 * @param block block-comment delimiters, or null if the language has none
 */
public record LanguageSyntax(
    String name,
    Set<String> extensions,
    String lineComment,
    BlockDelimiters block
) {

    /**
     * Open/close delimiter pair of a block comment.
     *
     * @param open opening delimiter, e.g. {@code /*}
     * @param close closing delimiter
     */
    public record BlockDelimiters(String open, String close) {
        public BlockDelimiters {
            Objects.requireNonNull(open, "open must not be null");
            Objects.requireNonNull(close, "close must not be null");
            if (open.isEmpty() || close.isEmpty()) {
                throw new IllegalArgumentException("block delimiters must not be empty");
            }
        }
    }

    /**
     * Compact constructor with validation.
     */
    public LanguageSyntax {
        Objects.requireNonNull(name, "name must not be null");
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("language " + name + " needs at least one extension");
        }
        extensions = extensions.stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        if (lineComment != null && lineComment.isEmpty()) {
            lineComment = null;
        }
        if (lineComment == null && block == null) {
            throw new IllegalArgumentException("language " + name + " declares no comment syntax");
        }
    }

    public static LanguageSyntax of(String name, Set<String> extensions, String lineComment) {
        return new LanguageSyntax(name, extensions, lineComment, null);
    }

    public static LanguageSyntax of(String name, Set<String> extensions, String lineComment,
                                    String blockOpen, String blockClose) {
        return new LanguageSyntax(name, extensions, lineComment, new BlockDelimiters(blockOpen, blockClose));
    }

    public Optional<String> lineMarker() {
        return Optional.ofNullable(lineComment);
    }

    public Optional<BlockDelimiters> blockDelimiters() {
        return Optional.ofNullable(block);
    }

    public boolean hasBlockComments() {
        return block != null;
    }

    @Override
    public String toString() {
        return name;
    }
}
