package com.todotracker.core.scanner;

/**
 * Receives progress callbacks from {@link ScanOrchestrator}.
 *
 * <p>Callbacks arrive from worker threads; implementations must be thread-safe.
 */
public interface ScanProgressListener {

    /** Listener that ignores all callbacks. */
    ScanProgressListener NONE = new ScanProgressListener() { };

    /**
     * Called once before any file is processed.
     *
     * @param totalFiles number of files in the scan
     */
    default void scanStarted(int totalFiles) {
    }

    /**
     * Called after each file, whatever its outcome.
     *
     * @param outcome the file's outcome
     */
    default void fileCompleted(FileScanOutcome outcome) {
    }

    /**
     * Called once after the last file.
     *
     * @param report the final report
     */
    default void scanFinished(ScanReport report) {
    }
}
