package com.todotracker.core.scanner.ast;

import com.todotracker.parser.CFamilyCommentLexer;
import com.todotracker.parser.HashCommentLexer;
import com.todotracker.parser.ScriptCommentLexer;
import com.todotracker.parser.YamlCommentLexer;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Comment grammar backed by an ANTLR lexer.
 *
 * <p>The lexer grammars under {@code src/main/antlr4} tokenise comments and string literals
 * and fall back to single-character tokens for everything else, so lexing always reaches
 * the end of input. The comment token
 * types are collected as ranges; string tokens only serve to keep comment markers inside
 * literals from starting a comment.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * CommentRangeParser parser = AntlrCommentRangeParser.cFamily();
 * List<CommentRange> ranges = parser.parse("let s = \"// no\"; // yes");
 * // one range, covering "// yes"
 * }</pre>
 *
 * @since 1.0.0
 */
public class AntlrCommentRangeParser implements CommentRangeParser {

    private static final boolean ANTLR_AVAILABLE = checkAntlrAvailability();

    private final String language;
    private final Function<CharStream, Lexer> lexerFactory;
    private final Set<Integer> commentTypes;

    public AntlrCommentRangeParser(String language, Function<CharStream, Lexer> lexerFactory,
                                   Set<Integer> commentTypes) {
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.lexerFactory = Objects.requireNonNull(lexerFactory, "lexerFactory must not be null");
        this.commentTypes = Set.copyOf(commentTypes);
    }

    /**
     * Grammar for C, C++, C#, Go, Rust, Kotlin, Scala and Swift.
     */
    public static AntlrCommentRangeParser cFamily() {
        return new AntlrCommentRangeParser("c-family", CFamilyCommentLexer::new,
            Set.of(CFamilyCommentLexer.LINE_COMMENT, CFamilyCommentLexer.BLOCK_COMMENT));
    }

    /**
     * Grammar for JavaScript, TypeScript, Dart and Groovy.
     */
    public static AntlrCommentRangeParser script() {
        return new AntlrCommentRangeParser("script", ScriptCommentLexer::new,
            Set.of(ScriptCommentLexer.LINE_COMMENT, ScriptCommentLexer.BLOCK_COMMENT));
    }

    /**
     * Grammar for Python, Ruby and Shell.
     */
    public static AntlrCommentRangeParser hash() {
        return new AntlrCommentRangeParser("hash", HashCommentLexer::new,
            Set.of(HashCommentLexer.LINE_COMMENT));
    }

    /**
     * Grammar for YAML.
     */
    public static AntlrCommentRangeParser yaml() {
        return new AntlrCommentRangeParser("yaml", YamlCommentLexer::new,
            Set.of(YamlCommentLexer.LINE_COMMENT));
    }

    private static boolean checkAntlrAvailability() {
        try {
            Class.forName("org.antlr.v4.runtime.Lexer");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public List<CommentRange> parse(String source) {
        CharStream input = CharStreams.fromString(source);
        Lexer lexer = lexerFactory.apply(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                    int charPositionInLine, String msg, RecognitionException e) {
                throw new ParseException(language + " lexer error at " + line + ":" + charPositionInLine + ": " + msg, e);
            }
        });

        // Token indices count code points; ranges are reported in chars
        int[] charIndex = SourceLines.codePointToCharIndex(source);
        List<CommentRange> ranges = new ArrayList<>();
        for (Token token = lexer.nextToken(); token.getType() != Token.EOF; token = lexer.nextToken()) {
            if (commentTypes.contains(token.getType())) {
                int start = token.getStartIndex();
                int end = token.getStopIndex() + 1;
                if (charIndex != null) {
                    start = charIndex[start];
                    end = charIndex[end];
                }
                ranges.add(new CommentRange(start, end));
            }
        }
        return ranges;
    }

    @Override
    public boolean isAvailable() {
        return ANTLR_AVAILABLE;
    }

    @Override
    public String getLanguage() {
        return language;
    }
}
