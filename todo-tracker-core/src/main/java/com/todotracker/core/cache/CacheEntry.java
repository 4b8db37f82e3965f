package com.todotracker.core.cache;

import com.todotracker.core.model.FileFingerprint;
import com.todotracker.core.model.Finding;

import java.util.List;
import java.util.Objects;

/**
 * Stored scan result of one file.
 *
 * @param fingerprint fingerprint the findings were computed for
 * @param findings findings in position order
 * @param schemaVersion schema version the entry was written with
 */
public record CacheEntry(FileFingerprint fingerprint, List<Finding> findings, int schemaVersion) {

    public CacheEntry {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    /**
     * Checks whether this entry may be served for a file with the given fingerprint.
     */
    public boolean isFreshFor(FileFingerprint current) {
        return fingerprint.equals(current) && schemaVersion == CacheSchema.VERSION;
    }
}
