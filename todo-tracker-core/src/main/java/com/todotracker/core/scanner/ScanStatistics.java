package com.todotracker.core.scanner;

import com.todotracker.core.model.Finding;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Statistics collected during a scan operation.
 *
 * <p>Per-file statistics are combined with {@link #merge(ScanStatistics)}, which is
 * associative and commutative, so the totals of a scan do not depend on how files were
 * distributed over workers or in which order they completed.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ScanStatistics total = outcomes.stream()
 *     .map(FileScanOutcome::statistics)
 *     .reduce(ScanStatistics.empty(), ScanStatistics::merge);
 * }</pre>
 *
 * @param filesScanned files whose findings were produced, freshly or from the cache
 * @param filesWithFindings files with at least one finding
 * @param totalFindings number of findings
 * @param findingsByTag number of findings per tag name
 * @param filesFromCache files served from the fingerprint cache
 * @param filesFailed files that produced a per-file error
 * @param filesSkipped files without a known language, or not started before cancellation
 * @param elapsed wall-clock duration
 *
 * @since 1.0.0
 */
public record ScanStatistics(
    int filesScanned,
    int filesWithFindings,
    int totalFindings,
    Map<String, Integer> findingsByTag,
    int filesFromCache,
    int filesFailed,
    int filesSkipped,
    Duration elapsed
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public ScanStatistics {
        if (filesScanned < 0) {
            filesScanned = 0;
        }
        if (filesWithFindings < 0) {
            filesWithFindings = 0;
        }
        if (totalFindings < 0) {
            totalFindings = 0;
        }
        if (filesFromCache < 0) {
            filesFromCache = 0;
        }
        if (filesFailed < 0) {
            filesFailed = 0;
        }
        if (filesSkipped < 0) {
            filesSkipped = 0;
        }
        findingsByTag = findingsByTag == null ? Map.of() : Map.copyOf(findingsByTag);
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    /**
     * Creates an empty statistics instance (no files processed). Identity of {@link #merge}.
     *
     * @return empty statistics
     */
    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, Map.of(), 0, 0, 0, Duration.ZERO);
    }

    /**
     * Statistics of one successfully processed file.
     *
     * @param findings the file's findings
     * @param fromCache whether the findings came from the cache
     * @return single-file statistics
     */
    public static ScanStatistics forFile(List<Finding> findings, boolean fromCache) {
        Builder builder = new Builder().incrementFilesScanned();
        if (fromCache) {
            builder.incrementFilesFromCache();
        }
        findings.forEach(builder::addFinding);
        if (!findings.isEmpty()) {
            builder.incrementFilesWithFindings();
        }
        return builder.build();
    }

    /**
     * Statistics of one file that produced an error.
     */
    public static ScanStatistics forFailedFile() {
        return new Builder().incrementFilesFailed().build();
    }

    /**
     * Statistics of one skipped file.
     */
    public static ScanStatistics forSkippedFile() {
        return new Builder().incrementFilesSkipped().build();
    }

    /**
     * Combines two statistics. Counts are added; the elapsed time is the longer of the two.
     *
     * @param other statistics to combine with
     * @return combined statistics
     */
    public ScanStatistics merge(ScanStatistics other) {
        Map<String, Integer> tags = new HashMap<>(findingsByTag);
        other.findingsByTag.forEach((tag, count) -> tags.merge(tag, count, Integer::sum));
        return new ScanStatistics(
            filesScanned + other.filesScanned,
            filesWithFindings + other.filesWithFindings,
            totalFindings + other.totalFindings,
            tags,
            filesFromCache + other.filesFromCache,
            filesFailed + other.filesFailed,
            filesSkipped + other.filesSkipped,
            elapsed.compareTo(other.elapsed) >= 0 ? elapsed : other.elapsed
        );
    }

    /**
     * Returns a copy with the elapsed time replaced.
     */
    public ScanStatistics withElapsed(Duration duration) {
        return new ScanStatistics(filesScanned, filesWithFindings, totalFindings, findingsByTag,
            filesFromCache, filesFailed, filesSkipped, duration);
    }

    /**
     * Returns the number of findings for a tag name (0 if none).
     */
    public int countFor(String tag) {
        return findingsByTag.getOrDefault(tag, 0);
    }

    /**
     * Returns true if any file produced an error.
     */
    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Scanned: %d (cached: %d), Skipped: %d, Failed: %d, Findings: %d in %d files %s, Time: %dms",
            filesScanned,
            filesFromCache,
            filesSkipped,
            filesFailed,
            totalFindings,
            filesWithFindings,
            new TreeMap<>(findingsByTag),
            elapsed.toMillis()
        );
    }

    /**
     * Builder for constructing ScanStatistics incrementally.
     */
    public static class Builder {
        private int filesScanned = 0;
        private int filesWithFindings = 0;
        private int totalFindings = 0;
        private final Map<String, Integer> findingsByTag = new HashMap<>();
        private int filesFromCache = 0;
        private int filesFailed = 0;
        private int filesSkipped = 0;

        public Builder incrementFilesScanned() {
            this.filesScanned++;
            return this;
        }

        public Builder incrementFilesWithFindings() {
            this.filesWithFindings++;
            return this;
        }

        public Builder incrementFilesFromCache() {
            this.filesFromCache++;
            return this;
        }

        public Builder incrementFilesFailed() {
            this.filesFailed++;
            return this;
        }

        public Builder incrementFilesSkipped() {
            this.filesSkipped++;
            return this;
        }

        public Builder addFinding(Finding finding) {
            this.totalFindings++;
            findingsByTag.merge(finding.tag().name(), 1, Integer::sum);
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(
                filesScanned,
                filesWithFindings,
                totalFindings,
                findingsByTag,
                filesFromCache,
                filesFailed,
                filesSkipped,
                Duration.ZERO
            );
        }
    }
}
