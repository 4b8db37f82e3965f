package com.todotracker.core.scanner.ast;

import java.util.List;

/**
 * Language grammar that reports where the comments of a source text are.
 *
 * <p>Unlike the baseline scanner, a grammar knows about string and character literals, so a
 * comment marker inside a literal does not open a comment.
 *
 * <p><b>Implementations:</b></p>
 * <ul>
 *   <li>{@link JavaCommentRangeParser}: full JavaParser AST</li>
 *   <li>{@link AntlrCommentRangeParser}: ANTLR lexer grammars for C-family, script and
 *       hash-comment languages</li>
 * </ul>
 *
 * @see CommentRangeParserFactory
 * @since 1.0.0
 */
public interface CommentRangeParser {

    /**
     * Returns the comment ranges of a source text, ordered by start offset.
     *
     * @param source decoded source text
     * @return comment ranges as character offsets into {@code source}
     * @throws ParseException if the grammar cannot process the source
     */
    List<CommentRange> parse(String source) throws ParseException;

    /**
     * Checks if the grammar can be used (i.e., its runtime classes are present).
     *
     * @return true if parser is available, false otherwise
     */
    boolean isAvailable();

    /**
     * Gets the grammar name, e.g. "java" or "c-family".
     *
     * @return grammar identifier
     */
    String getLanguage();

    /**
     * Exception thrown when a grammar rejects its input.
     */
    class ParseException extends RuntimeException {
        public ParseException(String message, Throwable cause) {
            super(message, cause);
        }

        public ParseException(String message) {
            super(message);
        }
    }
}
