package com.todotracker.core.model;

import java.util.Objects;

/**
 * A per-file failure recorded during a multi-file scan.
 *
 * <p>A failing file contributes zero findings and exactly one error; the rest of the scan
 * proceeds normally.
 *
 * @param file path of the file that failed
 * @param kind error category
 * @param message human-readable detail
 */
public record FileScanError(String file, Kind kind, String message) {

    /**
     * Error taxonomy for per-file failures.
     */
    public enum Kind {
        /** File missing or unreadable. */
        IO,
        /** Content is not valid text. */
        ENCODING,
        /** Content could not be parsed by the baseline scanner. */
        PARSE,
        /** Unexpected runtime failure while scanning this file. */
        INTERNAL
    }

    public FileScanError {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null) {
            message = "";
        }
    }

    @Override
    public String toString() {
        return file + ": [" + kind + "] " + message;
    }
}
