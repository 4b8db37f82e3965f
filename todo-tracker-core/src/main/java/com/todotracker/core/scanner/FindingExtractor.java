package com.todotracker.core.scanner;

import com.todotracker.core.io.SourceContent;
import com.todotracker.core.language.LanguageSyntax;
import com.todotracker.core.model.Finding;

import java.nio.file.Path;
import java.util.List;

/**
 * Strategy that produces findings for one file's content.
 *
 * <p>The baseline {@link com.todotracker.core.scanner.impl.CommentExtractor} and the
 * precision {@link com.todotracker.core.scanner.impl.AstCommentVerifier} are both
 * implementations; the verifier wraps another extractor, so its fail-open fallback is simply
 * the wrapped extractor's output.
 *
 * <p>Implementations must be thread-safe: one instance is shared by all scan workers.
 *
 * @see ScanOrchestrator
 * @see IncrementalScanner
 */
public interface FindingExtractor {

    /**
     * Returns a unique identifier for this strategy (kebab-case, e.g. "comment-extractor").
     *
     * @return strategy identifier
     */
    String getId();

    /**
     * Returns a human-readable name used in logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Extracts findings from validated text content.
     *
     * <p>Returned findings are ordered by line, then column. Implementations do not throw
     * for malformed source; content that cannot be understood yields fewer findings, not an
     * exception.
     *
     * @param file path reported in the findings
     * @param content file content
     * @param syntax comment syntax of the file's language
     * @return findings in position order (never null)
     */
    List<Finding> extract(Path file, SourceContent content, LanguageSyntax syntax);
}
