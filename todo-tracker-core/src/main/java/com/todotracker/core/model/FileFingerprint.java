package com.todotracker.core.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Cheap proxy for file content identity: modification time and byte size.
 *
 * <p>Two fingerprints are equal iff both fields match. Content is never hashed, so an edit
 * within the same millisecond that preserves the size goes unnoticed.
 *
 * @param modifiedMillis last modification time in epoch milliseconds
 * @param size file size in bytes
 */
public record FileFingerprint(long modifiedMillis, long size) {

    public FileFingerprint {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0, was " + size);
        }
    }

    /**
     * Stats a file. Reads filesystem metadata only, never content.
     *
     * @param file file to fingerprint
     * @return current fingerprint
     * @throws IOException if the file cannot be stat'ed
     */
    public static FileFingerprint of(Path file) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        return new FileFingerprint(attributes.lastModifiedTime().toMillis(), attributes.size());
    }
}
