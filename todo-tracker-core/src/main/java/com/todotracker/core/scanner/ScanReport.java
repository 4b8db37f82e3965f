package com.todotracker.core.scanner;

import com.todotracker.core.model.FileScanError;
import com.todotracker.core.model.Finding;

import java.util.List;

/**
 * Result of a multi-file scan.
 *
 * @param findings all findings, ordered by file, line and column
 * @param statistics merged statistics
 * @param errors per-file errors, ordered by file
 * @param cancelled whether the scan was stopped before visiting every file
 */
public record ScanReport(
    List<Finding> findings,
    ScanStatistics statistics,
    List<FileScanError> errors,
    boolean cancelled
) {
    /**
     * Compact constructor with validation.
     */
    public ScanReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
        if (statistics == null) {
            statistics = ScanStatistics.empty();
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ScanReport empty() {
        return new ScanReport(List.of(), ScanStatistics.empty(), List.of(), false);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
