package com.todotracker.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads file content, switching to a memory-mapped view above a size threshold.
 *
 * <p>Files up to {@link #getThreshold()} bytes are read into a heap array; larger files are
 * mapped read-only so peak heap usage stays bounded. Both paths return a
 * {@link SourceContent} with identical bytes, so extraction results do not depend on which
 * path was taken.
 */
public class LargeFileReader {

    /** Default mapping threshold: 256 KiB. */
    public static final long DEFAULT_THRESHOLD = 256L * 1024;

    private static final Logger log = LoggerFactory.getLogger(LargeFileReader.class);

    private final long threshold;

    public LargeFileReader() {
        this(DEFAULT_THRESHOLD);
    }

    /**
     * @param threshold size in bytes above which files are memory-mapped
     */
    public LargeFileReader(long threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0, was " + threshold);
        }
        this.threshold = threshold;
    }

    public long getThreshold() {
        return threshold;
    }

    /**
     * Reads and validates a file's content.
     *
     * @param file file to read
     * @return content view
     * @throws EncodingException if the content is not valid UTF-8 text
     * @throws IOException if the file cannot be read or mapped
     */
    public SourceContent read(Path file) throws IOException {
        SourceContent content = readRaw(file);
        content.validateText();
        return content;
    }

    /**
     * Reads a file's content without text validation.
     *
     * @param file file to read
     * @return content view
     * @throws IOException if the file cannot be read or mapped
     */
    public SourceContent readRaw(Path file) throws IOException {
        long size = Files.size(file);
        if (size <= threshold) {
            return SourceContent.ofBytes(Files.readAllBytes(file));
        }
        if (size > Integer.MAX_VALUE) {
            throw new IOException("File too large to scan (" + size + " bytes): " + file);
        }
        log.debug("Memory-mapping {} ({} bytes)", file, size);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            MappedByteBuffer mapped = channel.map(FileChannel.MapMode.READ_ONLY, 0, size);
            return SourceContent.ofMapped(mapped);
        }
    }
}
