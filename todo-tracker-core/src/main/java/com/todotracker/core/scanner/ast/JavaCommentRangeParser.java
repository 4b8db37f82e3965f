package com.todotracker.core.scanner.ast;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.comments.Comment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Comment grammar for Java backed by JavaParser.
 *
 * <p>The source is parsed into a {@link CompilationUnit}; every comment it carries
 * (attributed or orphan) becomes a range. Sources JavaParser rejects raise a
 * {@link ParseException} so the caller can fall back.
 */
public class JavaCommentRangeParser implements CommentRangeParser {

    private final ParserConfiguration configuration = new ParserConfiguration()
        .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public List<CommentRange> parse(String source) {
        // JavaParser instances keep parse state; one per call keeps this class thread-safe
        JavaParser javaParser = new JavaParser(configuration);
        ParseResult<CompilationUnit> result;
        try {
            result = javaParser.parse(source);
        } catch (RuntimeException e) {
            throw new ParseException("JavaParser failed: " + e.getMessage(), e);
        }

        Optional<CompilationUnit> unit = result.getResult();
        if (!result.isSuccessful() || unit.isEmpty()) {
            String problem = result.getProblems().isEmpty()
                ? "unknown problem"
                : result.getProblems().get(0).getVerboseMessage();
            throw new ParseException("Java source did not parse: " + problem);
        }

        int[] lineStarts = SourceLines.lineStarts(source);
        List<CommentRange> ranges = new ArrayList<>();
        for (Comment comment : unit.get().getAllComments()) {
            comment.getRange().ifPresent(range -> ranges.add(toCommentRange(range, lineStarts, source.length())));
        }
        ranges.sort(Comparator.comparingInt(CommentRange::start));
        return ranges;
    }

    private static CommentRange toCommentRange(Range range, int[] lineStarts, int length) {
        int start = offset(range.begin, lineStarts, length);
        // Range ends are inclusive
        int end = Math.min(offset(range.end, lineStarts, length) + 1, length);
        return new CommentRange(start, Math.max(start, end));
    }

    private static int offset(Position position, int[] lineStarts, int length) {
        int line = Math.min(Math.max(position.line, 1), lineStarts.length);
        return Math.min(lineStarts[line - 1] + Math.max(position.column - 1, 0), length);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String getLanguage() {
        return "java";
    }
}
