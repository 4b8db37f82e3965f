package com.todotracker.core.scanner.impl;

import com.todotracker.core.io.SourceContent;
import com.todotracker.core.language.LanguageSyntax;
import com.todotracker.core.model.CommentSpan;
import com.todotracker.core.model.Finding;
import com.todotracker.core.model.Tag;
import com.todotracker.core.scanner.base.AbstractFindingExtractor;
import com.todotracker.core.scanner.base.MetadataParser;
import com.todotracker.core.scanner.base.MetadataParser.Metadata;
import com.todotracker.core.scanner.base.TagVocabulary;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Baseline extraction strategy: locates comment spans with a two-state machine and parses
 * tags inside them.
 *
 * <p>The scanner walks the content line by line in byte space and is either
 * {@code OUTSIDE} a comment or {@code INSIDE_BLOCK}:
 * <ul>
 *   <li>{@code OUTSIDE}: whichever of the line marker and the block opener occurs first on
 *       the rest of the line wins; on a tie the block opener wins (Lua {@code --[[} versus
 *       {@code --}). A line marker turns the rest of the line into a comment.</li>
 *   <li>{@code INSIDE_BLOCK}: the first closing delimiter ends the block. Block comments do
 *       not nest. Scanning resumes {@code OUTSIDE} right after the delimiter, on the same
 *       line.</li>
 * </ul>
 * String literals are not recognised, so a tag inside a string that contains a comment
 * marker is reported; {@link AstCommentVerifier} removes those.
 *
 * <p>Only the comment text of each line is decoded, which keeps memory use bounded by the
 * longest line when the content is memory-mapped.
 *
 * <h2>Tag forms</h2>
 * <pre>
 * TODO: message
 * FIXME message
 * HACK(alice, #42, p:high): message
 * </pre>
 *
 * @see TagVocabulary
 * @see MetadataParser
 */
public class CommentExtractor extends AbstractFindingExtractor {

    private enum State {
        OUTSIDE,
        INSIDE_BLOCK
    }

    private final TagVocabulary vocabulary;

    public CommentExtractor() {
        this(TagVocabulary.defaults());
    }

    public CommentExtractor(TagVocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
    }

    @Override
    public String getId() {
        return "comment-extractor";
    }

    @Override
    public String getDisplayName() {
        return "Comment Extractor";
    }

    @Override
    public List<Finding> extract(Path file, SourceContent content, LanguageSyntax syntax) {
        List<Finding> findings = new ArrayList<>();
        String reported = reportedPath(file);
        scan(content, syntax, (from, to, lineStart, lineNumber) -> {
            if (to > from) {
                matchTags(content.decode(from, to), reported, lineNumber, from - lineStart, findings);
            }
        }, span -> { });
        return inPositionOrder(findings);
    }

    /**
     * Returns the comment spans of the content in source order.
     *
     * <p>An unterminated block comment extends to the end of the content.
     *
     * @param content file content
     * @param syntax comment syntax
     * @return comment spans
     */
    public List<CommentSpan> findSpans(SourceContent content, LanguageSyntax syntax) {
        List<CommentSpan> spans = new ArrayList<>();
        scan(content, syntax, (from, to, lineStart, lineNumber) -> { }, spans::add);
        return spans;
    }

    // ==================== Segment walk ====================

    @FunctionalInterface
    private interface SpanVisitor {
        void visit(CommentSpan span);
    }

    @FunctionalInterface
    private interface RangeVisitor {
        void visit(int from, int to, int lineStart, int lineNumber);
    }

    /**
     * Runs the state machine, reporting the comment bytes of every line and every complete
     * comment span.
     */
    private void scan(SourceContent content, LanguageSyntax syntax, RangeVisitor ranges, SpanVisitor spans) {
        byte[] lineMarker = syntax.lineMarker().map(CommentExtractor::utf8).orElse(null);
        byte[] open = syntax.blockDelimiters().map(b -> utf8(b.open())).orElse(null);
        byte[] close = syntax.blockDelimiters().map(b -> utf8(b.close())).orElse(null);

        int length = content.length();
        int lineStart = content.start();
        int lineNumber = 1;
        State state = State.OUTSIDE;
        int blockStartLine = 0;
        int blockStartOffset = 0;

        while (true) {
            int lineEnd = indexOf(content, (byte) '\n', lineStart, length);
            int newline = lineEnd < 0 ? length : lineEnd;
            int textEnd = newline;
            if (textEnd > lineStart && content.byteAt(textEnd - 1) == '\r') {
                textEnd--;
            }

            int cursor = lineStart;
            while (cursor <= textEnd) {
                if (state == State.INSIDE_BLOCK) {
                    int closeAt = indexOf(content, close, cursor, textEnd);
                    int segmentEnd = closeAt < 0 ? textEnd : closeAt;
                    ranges.visit(cursor, segmentEnd, lineStart, lineNumber);
                    if (closeAt < 0) {
                        break;
                    }
                    spans.visit(new CommentSpan(CommentSpan.Kind.BLOCK, blockStartLine, lineNumber,
                        blockStartOffset, closeAt));
                    state = State.OUTSIDE;
                    cursor = closeAt + close.length;
                    continue;
                }

                int markerAt = lineMarker == null ? -1 : indexOf(content, lineMarker, cursor, textEnd);
                int openAt = open == null ? -1 : indexOf(content, open, cursor, textEnd);
                if (openAt >= 0 && (markerAt < 0 || openAt <= markerAt)) {
                    state = State.INSIDE_BLOCK;
                    blockStartLine = lineNumber;
                    blockStartOffset = openAt + open.length;
                    cursor = blockStartOffset;
                    continue;
                }
                if (markerAt >= 0) {
                    int from = markerAt + lineMarker.length;
                    ranges.visit(from, textEnd, lineStart, lineNumber);
                    spans.visit(new CommentSpan(CommentSpan.Kind.LINE, lineNumber, lineNumber, from, textEnd));
                }
                break;
            }

            if (lineEnd < 0) {
                break;
            }
            lineStart = lineEnd + 1;
            lineNumber++;
        }

        if (state == State.INSIDE_BLOCK) {
            spans.visit(new CommentSpan(CommentSpan.Kind.BLOCK, blockStartLine, lineNumber,
                blockStartOffset, length));
        }
    }

    private static int indexOf(SourceContent content, byte value, int from, int to) {
        for (int i = from; i < to; i++) {
            if (content.byteAt(i) == value) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOf(SourceContent content, byte[] token, int from, int to) {
        int last = to - token.length;
        byte first = token[0];
        for (int i = from; i <= last; i++) {
            if (content.byteAt(i) == first && content.regionMatches(i, token)) {
                return i;
            }
        }
        return -1;
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    // ==================== Tag matching ====================

    private void matchTags(String segment, String file, int lineNumber, int columnOffset, List<Finding> out) {
        Matcher matcher = vocabulary.pattern().matcher(segment);
        int from = 0;
        while (from < segment.length() && matcher.find(from)) {
            Optional<Tag> resolved = vocabulary.resolve(matcher.group(1));
            int after = matcher.end(1);
            if (resolved.isEmpty()) {
                from = after;
                continue;
            }

            Metadata metadata = Metadata.EMPTY;
            if (after < segment.length() && segment.charAt(after) == '(') {
                int groupEnd = segment.indexOf(')', after + 1);
                if (groupEnd >= 0) {
                    metadata = MetadataParser.parse(segment.substring(after + 1, groupEnd));
                    after = groupEnd + 1;
                }
            }

            int column = columnOffset + utf8Length(segment, matcher.start(1));
            out.add(new Finding(resolved.get(), message(segment, after), file, lineNumber, column,
                metadata.author(), metadata.issue(), metadata.priority()));
            from = after;
        }
    }

    private static String message(String segment, int from) {
        int start = from;
        while (start < segment.length()) {
            char c = segment.charAt(start);
            if (c == ':' || c == '-' || Character.isWhitespace(c)) {
                start++;
            } else {
                break;
            }
        }
        return segment.substring(start).strip();
    }

    /**
     * Extracts findings from in-memory content, reporting them under an empty path.
     *
     * @param content content to scan
     * @param syntax comment syntax
     * @param vocabulary tags to look for
     * @return findings in position order
     */
    public static List<Finding> extract(SourceContent content, LanguageSyntax syntax, TagVocabulary vocabulary) {
        return new CommentExtractor(vocabulary).extract(Path.of(""), content, syntax);
    }
}
