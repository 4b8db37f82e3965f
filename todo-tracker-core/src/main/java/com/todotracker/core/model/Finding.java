package com.todotracker.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * One detected tag occurrence with its parsed metadata.
 *
 * <p>Metadata ({@code author}, {@code issue}, {@code priority}) is populated only from the
 * tag's own parenthetical group, e.g. {@code TODO(alice, #42, p:high)}; it is never inferred
 * from surrounding text.
 *
 * @param tag matched tag
 * @param message free text following the tag, trimmed (may be empty)
 * @param file file the finding was found in
 * @param line 1-based line number of the tag occurrence
 * @param column 0-based byte offset of the tag within its line
 * @param author author from the field group, or null
 * @param issue issue reference from the field group without a leading {@code #}, or null
 * @param priority priority from the field group, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Finding(
    @JsonProperty("tag") Tag tag,
    @JsonProperty("message") String message,
    @JsonProperty("file") String file,
    @JsonProperty("line") int line,
    @JsonProperty("column") int column,
    @JsonProperty("author") String author,
    @JsonProperty("issue") String issue,
    @JsonProperty("priority") Priority priority
) {
    /**
     * Orders findings within one file: line, then column.
     */
    public static final Comparator<Finding> BY_POSITION =
        Comparator.comparingInt(Finding::line).thenComparingInt(Finding::column);

    /**
     * Orders findings across files: file path, then position.
     */
    public static final Comparator<Finding> BY_FILE_AND_POSITION =
        Comparator.comparing(Finding::file).thenComparing(BY_POSITION);

    /**
     * Compact constructor with validation.
     */
    public Finding {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(file, "file must not be null");
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, was " + line);
        }
        if (column < 0) {
            throw new IllegalArgumentException("column must be >= 0, was " + column);
        }
        if (message == null) {
            message = "";
        }
    }

    /**
     * Creates a bare finding without metadata.
     */
    public static Finding bare(Tag tag, String message, String file, int line, int column) {
        return new Finding(tag, message, file, line, column, null, null, null);
    }

    /**
     * Returns this finding reported under another file path.
     */
    public Finding withFile(String otherFile) {
        if (file.equals(otherFile)) {
            return this;
        }
        return new Finding(tag, message, otherFile, line, column, author, issue, priority);
    }

    public boolean hasMetadata() {
        return author != null || issue != null || priority != null;
    }
}
