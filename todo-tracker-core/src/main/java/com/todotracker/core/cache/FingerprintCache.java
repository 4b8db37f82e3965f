package com.todotracker.core.cache;

import com.todotracker.core.model.FileFingerprint;
import com.todotracker.core.model.Finding;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Durable store mapping a file path to the findings last computed for it, keyed by the
 * file's fingerprint.
 *
 * <p>Implementations must be safe for concurrent use by scan workers. Every {@link #put} is
 * atomic: a reader sees either the previous entry or the new one, never a mix.
 *
 * @see SqliteFingerprintCache
 */
public interface FingerprintCache extends AutoCloseable {

    /**
     * Returns the stored entry for a file, whatever its fingerprint.
     *
     * @param file file path
     * @return stored entry, or empty if none (or if it cannot be decoded)
     * @throws CacheException if the store cannot be read
     */
    Optional<CacheEntry> get(Path file);

    /**
     * Stores the findings of a file under its fingerprint, replacing any previous entry.
     *
     * @param file file path
     * @param fingerprint fingerprint the findings were computed for
     * @param findings findings in position order
     * @throws CacheException if the store cannot be written
     */
    void put(Path file, FileFingerprint fingerprint, List<Finding> findings);

    /**
     * Checks whether a stored entry exists with an equal fingerprint and the current schema
     * version.
     */
    default boolean isFresh(Path file, FileFingerprint fingerprint) {
        return get(file).map(entry -> entry.isFreshFor(fingerprint)).orElse(false);
    }

    /**
     * Removes all entries.
     */
    void clear();

    /**
     * Returns the number of stored entries.
     */
    long size();

    @Override
    void close();
}
