package com.todotracker.core.scanner.ast;

import com.todotracker.core.language.LanguageSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory resolving the comment grammar for a language.
 *
 * <p>Grammar instances are created on demand and cached, one per grammar. Languages without
 * a grammar resolve to empty, which callers treat as "keep the baseline result".
 *
 * <p><b>Supported Languages:</b></p>
 * <ul>
 *   <li>Java: {@link JavaCommentRangeParser}</li>
 *   <li>C, C++, C#, Go, Rust, Kotlin, Scala, Swift: {@link AntlrCommentRangeParser#cFamily()}</li>
 *   <li>JavaScript, TypeScript, Dart, Groovy: {@link AntlrCommentRangeParser#script()}</li>
 *   <li>Python, Ruby, Shell: {@link AntlrCommentRangeParser#hash()}</li>
 *   <li>YAML: {@link AntlrCommentRangeParser#yaml()}</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b></p>
 * <p>This factory is thread-safe. Parser instances are cached in a {@link ConcurrentHashMap}
 * and initialized only once per grammar.</p>
 *
 * @see CommentRangeParser
 * @since 1.0.0
 */
public final class CommentRangeParserFactory {

    private static final Logger log = LoggerFactory.getLogger(CommentRangeParserFactory.class);

    private static final String JAVA = "java";
    private static final String C_FAMILY = "c-family";
    private static final String SCRIPT = "script";
    private static final String HASH = "hash";
    private static final String YAML = "yaml";

    private static final Map<String, String> GRAMMAR_BY_LANGUAGE = Map.ofEntries(
        Map.entry("Java", JAVA),
        Map.entry("C", C_FAMILY),
        Map.entry("C++", C_FAMILY),
        Map.entry("C#", C_FAMILY),
        Map.entry("Go", C_FAMILY),
        Map.entry("Rust", C_FAMILY),
        Map.entry("Kotlin", C_FAMILY),
        Map.entry("Scala", C_FAMILY),
        Map.entry("Swift", C_FAMILY),
        Map.entry("JavaScript", SCRIPT),
        Map.entry("TypeScript", SCRIPT),
        Map.entry("Dart", SCRIPT),
        Map.entry("Groovy", SCRIPT),
        Map.entry("Python", HASH),
        Map.entry("Ruby", HASH),
        Map.entry("Shell", HASH),
        Map.entry("YAML", YAML)
    );

    // Cache of parser instances (one per grammar)
    private static final Map<String, CommentRangeParser> parserCache = new ConcurrentHashMap<>();

    private CommentRangeParserFactory() {
        // Utility class - no instantiation
    }

    /**
     * Resolves the grammar for a language.
     *
     * @param syntax language syntax
     * @return available grammar, or empty if the language has none
     */
    public static Optional<CommentRangeParser> forLanguage(LanguageSyntax syntax) {
        String grammar = GRAMMAR_BY_LANGUAGE.get(syntax.name());
        if (grammar == null) {
            return Optional.empty();
        }
        CommentRangeParser parser = parserCache.computeIfAbsent(grammar, CommentRangeParserFactory::createParser);
        if (!parser.isAvailable()) {
            log.debug("Grammar '{}' for {} is not available", grammar, syntax.name());
            return Optional.empty();
        }
        return Optional.of(parser);
    }

    /**
     * Checks whether a language has a grammar.
     */
    public static boolean supports(LanguageSyntax syntax) {
        return GRAMMAR_BY_LANGUAGE.containsKey(syntax.name());
    }

    private static CommentRangeParser createParser(String grammar) {
        Supplier<CommentRangeParser> supplier = switch (grammar) {
            case JAVA -> JavaCommentRangeParser::new;
            case C_FAMILY -> AntlrCommentRangeParser::cFamily;
            case SCRIPT -> AntlrCommentRangeParser::script;
            case HASH -> AntlrCommentRangeParser::hash;
            case YAML -> AntlrCommentRangeParser::yaml;
            default -> throw new IllegalArgumentException("Unknown grammar: " + grammar);
        };
        log.debug("Created {} comment grammar", grammar);
        return supplier.get();
    }
}
