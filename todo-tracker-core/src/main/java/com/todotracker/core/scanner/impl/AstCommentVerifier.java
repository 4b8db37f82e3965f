package com.todotracker.core.scanner.impl;

import com.todotracker.core.io.SourceContent;
import com.todotracker.core.language.LanguageSyntax;
import com.todotracker.core.model.Finding;
import com.todotracker.core.scanner.FindingExtractor;
import com.todotracker.core.scanner.ast.CommentRange;
import com.todotracker.core.scanner.ast.CommentRangeParser;
import com.todotracker.core.scanner.ast.CommentRangeParserFactory;
import com.todotracker.core.scanner.ast.SourceLines;
import com.todotracker.core.scanner.ast.VerificationStats;
import com.todotracker.core.scanner.base.AbstractFindingExtractor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Precision strategy: keeps only the candidates of a wrapped strategy that a language grammar
 * confirms are inside a comment.
 *
 * <p>This strategy implements a two-tier approach:
 * <ol>
 *   <li><b>Tier 1:</b> Parse the content with the language grammar and keep each candidate
 *       whose position falls inside a comment range.</li>
 *   <li><b>Tier 2:</b> If the language has no grammar or the grammar rejects the content,
 *       return the candidates unchanged (fail-open).</li>
 * </ol>
 * It never adds findings, so its output is always a subset of the wrapped strategy's output.
 *
 * <p>The content is decoded as a whole for parsing, so memory use in this mode is
 * proportional to the file size.
 *
 * @see CommentRangeParserFactory
 * @see VerificationStats
 */
public class AstCommentVerifier extends AbstractFindingExtractor {

    private final FindingExtractor delegate;
    private final Function<LanguageSyntax, Optional<CommentRangeParser>> grammars;
    private final VerificationStats stats = new VerificationStats();

    public AstCommentVerifier(FindingExtractor delegate) {
        this(delegate, CommentRangeParserFactory::forLanguage);
    }

    /**
     * Creates a verifier with a custom grammar lookup.
     *
     * @param delegate strategy producing the candidates
     * @param grammars grammar lookup by language
     */
    public AstCommentVerifier(FindingExtractor delegate,
                              Function<LanguageSyntax, Optional<CommentRangeParser>> grammars) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.grammars = Objects.requireNonNull(grammars, "grammars must not be null");
    }

    @Override
    public String getId() {
        return "ast-verifier";
    }

    @Override
    public String getDisplayName() {
        return "AST Verifier (" + delegate.getDisplayName() + ")";
    }

    @Override
    public List<Finding> extract(Path file, SourceContent content, LanguageSyntax syntax) {
        List<Finding> candidates = delegate.extract(file, content, syntax);
        return verify(file, content, syntax, candidates);
    }

    /**
     * Filters candidates down to those inside grammar-confirmed comments.
     *
     * @param file file the candidates belong to (for logging)
     * @param content file content
     * @param syntax language syntax
     * @param candidates baseline findings
     * @return the verified subset, in the candidates' order
     */
    public List<Finding> verify(Path file, SourceContent content, LanguageSyntax syntax, List<Finding> candidates) {
        if (candidates.isEmpty()) {
            return candidates;
        }

        Optional<CommentRangeParser> grammar = grammars.apply(syntax);
        if (grammar.isEmpty()) {
            stats.recordFallback(candidates.size());
            return candidates;
        }

        String text = content.text();
        List<CommentRange> ranges;
        try {
            ranges = grammar.get().parse(text);
        } catch (CommentRangeParser.ParseException e) {
            log.debug("Grammar '{}' failed on {}, keeping {} candidates: {}",
                grammar.get().getLanguage(), file, candidates.size(), e.getMessage());
            stats.recordFallback(candidates.size());
            return candidates;
        }

        int[] lineStarts = SourceLines.lineStarts(text);
        List<Finding> verified = new ArrayList<>(candidates.size());
        for (Finding candidate : candidates) {
            int offset = SourceLines.charOffset(text, lineStarts, candidate.line(), candidate.column());
            if (offset >= 0 && insideComment(ranges, offset)) {
                verified.add(candidate);
            }
        }

        int discarded = candidates.size() - verified.size();
        stats.recordVerified(verified.size(), discarded);
        if (discarded > 0) {
            log.debug("Filtered {} of {} candidates in {}", discarded, candidates.size(), file);
        }
        return verified;
    }

    /**
     * Binary search over ranges sorted by start offset.
     */
    private static boolean insideComment(List<CommentRange> ranges, int offset) {
        int low = 0;
        int high = ranges.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            CommentRange range = ranges.get(mid);
            if (range.contains(offset)) {
                return true;
            }
            if (offset < range.start()) {
                high = mid - 1;
            } else {
                low = mid + 1;
            }
        }
        return false;
    }

    public VerificationStats getStats() {
        return stats;
    }

    /**
     * Logs the accumulated precision counters if any candidate was filtered.
     */
    public void logSummary() {
        if (stats.getDiscarded() > 0) {
            log.info("{}", stats.getSummary());
        }
    }
}
