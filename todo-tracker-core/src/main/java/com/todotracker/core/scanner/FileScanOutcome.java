package com.todotracker.core.scanner;

import com.todotracker.core.model.FileScanError;
import com.todotracker.core.model.Finding;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of processing one file.
 *
 * @param file processed file
 * @param status how the file was processed
 * @param findings findings in position order (empty unless scanned or cached)
 * @param error per-file error, present only for {@link Status#FAILED}
 */
public record FileScanOutcome(Path file, Status status, List<Finding> findings, FileScanError error) {

    public enum Status {
        /** Content was read and extracted. */
        SCANNED,
        /** Findings were served from the fingerprint cache. */
        CACHED,
        /** No known language, or cancelled before start. */
        SKIPPED,
        /** Reading or extraction failed. */
        FAILED
    }

    public FileScanOutcome {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(status, "status must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
        if (status == Status.FAILED && error == null) {
            throw new IllegalArgumentException("failed outcome requires an error");
        }
    }

    public static FileScanOutcome scanned(Path file, List<Finding> findings) {
        return new FileScanOutcome(file, Status.SCANNED, findings, null);
    }

    public static FileScanOutcome cached(Path file, List<Finding> findings) {
        return new FileScanOutcome(file, Status.CACHED, findings, null);
    }

    public static FileScanOutcome skipped(Path file) {
        return new FileScanOutcome(file, Status.SKIPPED, List.of(), null);
    }

    public static FileScanOutcome failed(Path file, FileScanError error) {
        return new FileScanOutcome(file, Status.FAILED, List.of(), error);
    }

    public boolean fromCache() {
        return status == Status.CACHED;
    }

    /**
     * Single-file statistics for this outcome.
     */
    public ScanStatistics statistics() {
        return switch (status) {
            case SCANNED -> ScanStatistics.forFile(findings, false);
            case CACHED -> ScanStatistics.forFile(findings, true);
            case SKIPPED -> ScanStatistics.forSkippedFile();
            case FAILED -> ScanStatistics.forFailedFile();
        };
    }
}
