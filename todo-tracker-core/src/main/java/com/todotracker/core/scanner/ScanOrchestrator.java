package com.todotracker.core.scanner;

import com.todotracker.core.cache.FingerprintCache;
import com.todotracker.core.discovery.FileDiscovery;
import com.todotracker.core.io.EncodingException;
import com.todotracker.core.io.LargeFileReader;
import com.todotracker.core.language.LanguageRegistry;
import com.todotracker.core.language.LanguageSyntax;
import com.todotracker.core.model.FileScanError;
import com.todotracker.core.model.Finding;
import com.todotracker.core.scanner.ast.CommentRangeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Top-level entry point: scans a list of files with a bounded worker pool.
 *
 * <p>Each worker takes one file at a time and runs it to completion: language lookup,
 * cache check, content read, extraction. Workers share nothing except the cache. Results are
 * merged after the pool has finished:
 * <ul>
 *   <li>findings are sorted by file, line and column</li>
 *   <li>statistics are reduced with {@link ScanStatistics#merge}</li>
 *   <li>per-file errors are collected, one per failed file</li>
 * </ul>
 * so the report does not depend on the number of workers or on completion order.
 *
 * <p><b>Error Handling:</b></p>
 * <p>No per-file problem aborts the scan. Unreadable files, invalid text and unexpected
 * failures inside one file each become a {@link FileScanError}; files of unknown languages
 * are skipped.</p>
 *
 * <p><b>Cancellation:</b></p>
 * <p>{@link #cancel()} stops the scan at file granularity. Files already in progress finish
 * (and keep their cache writes); files not yet started are skipped. The report is then
 * flagged as cancelled. A cancelled orchestrator stays cancelled.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ScanOrchestrator orchestrator = ScanOrchestrator.builder()
 *     .workers(8)
 *     .cache(cache)
 *     .build();
 * ScanReport report = orchestrator.scan(files, new CommentExtractor());
 * }</pre>
 *
 * @see IncrementalScanner
 * @since 1.0.0
 */
public class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final LanguageRegistry registry;
    private final FingerprintCache cache;
    private final LargeFileReader reader;
    private final int workers;
    private final ScanProgressListener listener;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private ScanOrchestrator(Builder builder) {
        this.registry = builder.registry;
        this.cache = builder.cache;
        this.reader = builder.reader;
        this.workers = builder.workers;
        this.listener = builder.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Discovers files and scans them.
     *
     * @param discovery file source
     * @param strategy extraction strategy
     * @return merged report
     * @throws IOException if discovery fails
     */
    public ScanReport scan(FileDiscovery discovery, FindingExtractor strategy) throws IOException {
        return scan(discovery.discover(), strategy);
    }

    /**
     * Scans files with an extraction strategy.
     *
     * @param files files to scan
     * @param strategy extraction strategy, shared by all workers
     * @return merged report
     */
    public ScanReport scan(List<Path> files, FindingExtractor strategy) {
        Objects.requireNonNull(files, "files must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");

        Instant start = Instant.now();
        log.info("Scanning {} files with {} ({} workers)", files.size(), strategy.getDisplayName(), workers);
        listener.scanStarted(files.size());

        IncrementalScanner scanner = new IncrementalScanner(strategy, cache, reader);
        AtomicBoolean skippedByCancel = new AtomicBoolean();
        List<FileScanOutcome> outcomes = new ArrayList<>(files.size());

        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        try {
            List<Future<FileScanOutcome>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> {
                    FileScanOutcome outcome = processFile(file, scanner, skippedByCancel);
                    listener.fileCompleted(outcome);
                    return outcome;
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), files.get(i)));
            }
        } finally {
            executor.shutdownNow();
        }

        ScanReport report = merge(outcomes, Duration.between(start, Instant.now()), skippedByCancel.get());
        log.info("Scan {}: {}", report.cancelled() ? "cancelled" : "complete", report.statistics().getSummary());
        listener.scanFinished(report);
        return report;
    }

    /**
     * Requests cancellation. Files not yet started are skipped.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Scan cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // ==================== Per-file processing ====================

    private FileScanOutcome processFile(Path file, IncrementalScanner scanner, AtomicBoolean skippedByCancel) {
        if (cancelled.get()) {
            skippedByCancel.set(true);
            return FileScanOutcome.skipped(file);
        }

        Optional<LanguageSyntax> syntax = registry.lookup(file);
        if (syntax.isEmpty()) {
            log.debug("Skipping {} (no known language)", file);
            return FileScanOutcome.skipped(file);
        }

        try {
            return scanner.scan(file, syntax.get());
        } catch (EncodingException e) {
            log.debug("Not a text file: {} ({})", file, e.getMessage());
            return failed(file, FileScanError.Kind.ENCODING, e.getMessage());
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", file, e.getMessage());
            return failed(file, FileScanError.Kind.IO, describe(e));
        } catch (CommentRangeParser.ParseException e) {
            log.debug("Cannot parse {}: {}", file, e.getMessage());
            return failed(file, FileScanError.Kind.PARSE, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected failure scanning {}", file, e);
            return failed(file, FileScanError.Kind.INTERNAL, describe(e));
        }
    }

    private static FileScanOutcome failed(Path file, FileScanError.Kind kind, String message) {
        return FileScanOutcome.failed(file, new FileScanError(file.toString(), kind, message));
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private FileScanOutcome await(Future<FileScanOutcome> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            future.cancel(false);
            return FileScanOutcome.skipped(file);
        } catch (ExecutionException e) {
            // processFile converts every exception; only errors such as OutOfMemoryError get here
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Worker failed on {}", file, cause);
            return failed(file, FileScanError.Kind.INTERNAL, cause.toString());
        }
    }

    private ScanReport merge(List<FileScanOutcome> outcomes, Duration elapsed, boolean stoppedEarly) {
        List<Finding> findings = new ArrayList<>();
        List<FileScanError> errors = new ArrayList<>();
        ScanStatistics statistics = ScanStatistics.empty();
        for (FileScanOutcome outcome : outcomes) {
            findings.addAll(outcome.findings());
            if (outcome.error() != null) {
                errors.add(outcome.error());
            }
            statistics = statistics.merge(outcome.statistics());
        }
        findings.sort(Finding.BY_FILE_AND_POSITION);
        errors.sort(Comparator.comparing(FileScanError::file));
        return new ScanReport(findings, statistics.withElapsed(elapsed), errors, stoppedEarly || cancelled.get());
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "todo-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Builder for ScanOrchestrator.
     */
    public static class Builder {
        private LanguageRegistry registry = LanguageRegistry.defaultRegistry();
        private FingerprintCache cache;
        private LargeFileReader reader = new LargeFileReader();
        private int workers = Runtime.getRuntime().availableProcessors();
        private ScanProgressListener listener = ScanProgressListener.NONE;

        public Builder registry(LanguageRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
            return this;
        }

        /**
         * Sets the fingerprint cache; null (the default) disables caching.
         */
        public Builder cache(FingerprintCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder reader(LargeFileReader reader) {
            this.reader = Objects.requireNonNull(reader, "reader must not be null");
            return this;
        }

        public Builder workers(int workers) {
            if (workers < 1) {
                throw new IllegalArgumentException("workers must be >= 1, was " + workers);
            }
            this.workers = workers;
            return this;
        }

        public Builder listener(ScanProgressListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        public ScanOrchestrator build() {
            return new ScanOrchestrator(this);
        }
    }
}
