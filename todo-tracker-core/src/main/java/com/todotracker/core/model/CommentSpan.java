package com.todotracker.core.model;

/**
 * A contiguous range of source classified as comment text by the baseline scanner.
 *
 * <p>Offsets are byte offsets into the file content and exclude the comment delimiters.
 * A block span covering several lines is reported once, with its first and last line.
 *
 * @param kind line or block comment
 * @param startLine 1-based first line
 * @param endLine 1-based last line (equal to startLine for line comments)
 * @param startOffset byte offset of the first comment byte (inclusive)
 * @param endOffset byte offset after the last comment byte (exclusive)
 */
public record CommentSpan(Kind kind, int startLine, int endLine, int startOffset, int endOffset) {

    public enum Kind {
        LINE,
        BLOCK
    }

    public CommentSpan {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("invalid line range " + startLine + ".." + endLine);
        }
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("invalid offset range " + startOffset + ".." + endOffset);
        }
    }

    public boolean contains(int offset) {
        return offset >= startOffset && offset < endOffset;
    }
}
