package com.todotracker.core.scanner.ast;

/**
 * A comment region reported by a grammar, as character offsets into the decoded source text.
 *
 * @param start offset of the first character of the comment, delimiter included
 * @param end offset after the last character of the comment (exclusive)
 */
public record CommentRange(int start, int end) {

    public CommentRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid comment range " + start + ".." + end);
        }
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }
}
