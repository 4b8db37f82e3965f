package com.todotracker.core.scanner;

import com.todotracker.core.cache.CacheEntry;
import com.todotracker.core.cache.CacheException;
import com.todotracker.core.cache.FingerprintCache;
import com.todotracker.core.io.LargeFileReader;
import com.todotracker.core.io.SourceContent;
import com.todotracker.core.language.LanguageSyntax;
import com.todotracker.core.model.FileFingerprint;
import com.todotracker.core.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scans one file, consulting a {@link FingerprintCache} first.
 *
 * <p>The file's fingerprint is taken from its metadata alone. When the cache holds an entry
 * with the same fingerprint and schema version, its findings are returned and the content is
 * never opened. Otherwise the content is read, the strategy runs, and the result is stored
 * under the new fingerprint.
 *
 * <p>Cache problems never fail a file: a read error counts as a miss, a write error is logged
 * and the fresh findings are returned anyway.
 */
public class IncrementalScanner {

    private static final Logger log = LoggerFactory.getLogger(IncrementalScanner.class);

    private final FindingExtractor extractor;
    private final FingerprintCache cache;
    private final LargeFileReader reader;

    /**
     * Creates a scanner without a cache; every call reads and extracts.
     */
    public IncrementalScanner(FindingExtractor extractor, LargeFileReader reader) {
        this(extractor, null, reader);
    }

    /**
     * Creates a caching scanner.
     *
     * @param extractor extraction strategy
     * @param cache fingerprint cache, or null to disable caching
     * @param reader content reader
     */
    public IncrementalScanner(FindingExtractor extractor, FingerprintCache cache, LargeFileReader reader) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.cache = cache;
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    /**
     * Produces the findings of one file.
     *
     * @param file file to scan
     * @param syntax the file's comment syntax
     * @return scanned or cached outcome
     * @throws IOException if the file cannot be read or is not valid text
     */
    public FileScanOutcome scan(Path file, LanguageSyntax syntax) throws IOException {
        if (cache == null) {
            return FileScanOutcome.scanned(file, extract(file, syntax));
        }

        FileFingerprint fingerprint = FileFingerprint.of(file);
        Optional<CacheEntry> entry = lookup(file);
        if (entry.isPresent() && entry.get().isFreshFor(fingerprint)) {
            log.trace("Cache hit: {}", file);
            String reported = file.toString();
            return FileScanOutcome.cached(file, entry.get().findings().stream()
                .map(finding -> finding.withFile(reported))
                .toList());
        }

        List<Finding> findings = extract(file, syntax);
        store(file, fingerprint, findings);
        return FileScanOutcome.scanned(file, findings);
    }

    private List<Finding> extract(Path file, LanguageSyntax syntax) throws IOException {
        SourceContent content = reader.read(file);
        return extractor.extract(file, content, syntax);
    }

    private Optional<CacheEntry> lookup(Path file) {
        try {
            return cache.get(file);
        } catch (CacheException e) {
            log.warn("Cache read failed for {}, rescanning: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void store(Path file, FileFingerprint fingerprint, List<Finding> findings) {
        try {
            cache.put(file, fingerprint, findings);
        } catch (CacheException e) {
            log.warn("Cache write failed for {}: {}", file, e.getMessage());
        }
    }
}
