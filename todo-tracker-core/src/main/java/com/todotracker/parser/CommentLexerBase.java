package com.todotracker.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.Set;

/**
 * Base class for comment lexers whose literal rules depend on the preceding token.
 *
 * <p>Remembers the text of the last token that is neither whitespace nor a comment, and
 * whether a line break was seen since. Grammars use the predicates below to decide whether
 * a {@code /} opens a regular expression literal and whether a quote opens a string.
 */
public abstract class CommentLexerBase extends Lexer {

    private static final Set<String> REGEX_PRECEDING_KEYWORDS = Set.of(
        "return", "typeof", "instanceof", "in", "of", "new", "delete", "void",
        "throw", "case", "do", "else", "yield", "await");

    private String previousText;
    private boolean lineStart = true;

    protected CommentLexerBase(CharStream input) {
        super(input);
    }

    @Override
    public Token nextToken() {
        Token token = super.nextToken();
        String text = token.getType() == Token.EOF ? null : token.getText();
        if (text == null || text.isEmpty()) {
            return token;
        }
        if (text.isBlank()) {
            if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
                lineStart = true;
            }
        } else if (!isComment(text)) {
            previousText = text;
            lineStart = false;
        }
        return token;
    }

    /**
     * Whether a {@code /} at the current position starts a regular expression literal
     * rather than a division operator.
     */
    protected boolean isRegexAllowed() {
        if (previousText == null) {
            return true;
        }
        char last = previousText.charAt(previousText.length() - 1);
        if (Character.isLetterOrDigit(last) || last == '_' || last == '$') {
            return REGEX_PRECEDING_KEYWORDS.contains(previousText);
        }
        return last != ')' && last != ']' && last != '}'
            && last != '"' && last != '\'' && last != '`';
    }

    /**
     * Whether the current position starts a YAML scalar, where a quote opens a quoted
     * scalar instead of being plain text.
     */
    protected boolean isScalarStart() {
        if (lineStart || previousText == null) {
            return true;
        }
        char last = previousText.charAt(previousText.length() - 1);
        return last == ':' || last == '-' || last == '?' || last == ','
            || last == '[' || last == '{';
    }

    private static boolean isComment(String text) {
        return text.startsWith("//") || text.startsWith("/*") || text.startsWith("#");
    }
}
