package com.todotracker.core.scanner.base;

import com.todotracker.core.model.Finding;
import com.todotracker.core.scanner.FindingExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for extraction strategies providing common functionality.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per strategy class)</li>
 *   <li>Reported file path normalisation ({@link #reportedPath(Path)})</li>
 *   <li>UTF-8 length helper for converting string indices to byte columns</li>
 *   <li>Result ordering ({@link #inPositionOrder(List)})</li>
 * </ul>
 *
 * @see FindingExtractor
 * @since 1.0.0
 */
public abstract class AbstractFindingExtractor implements FindingExtractor {

    /**
     * Logger instance for this strategy, named after the concrete class.
     */
    protected final Logger log;

    protected AbstractFindingExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Returns the path string stored in findings for a file.
     *
     * @param file scanned file
     * @return path as given by the caller, with platform separators
     */
    protected String reportedPath(Path file) {
        return file.toString();
    }

    /**
     * Counts the UTF-8 bytes needed to encode {@code text[0, endIndex)}.
     *
     * @param text decoded text
     * @param endIndex char index (exclusive)
     * @return encoded length in bytes
     */
    protected static int utf8Length(String text, int endIndex) {
        int bytes = 0;
        for (int i = 0; i < endIndex; i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < endIndex
                && Character.isLowSurrogate(text.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }

    /**
     * Returns a copy of the findings sorted by line, then column.
     */
    protected List<Finding> inPositionOrder(List<Finding> findings) {
        List<Finding> sorted = new ArrayList<>(findings);
        sorted.sort(Finding.BY_POSITION);
        return sorted;
    }
}
