package com.todotracker.core.io;

import java.io.IOException;

/**
 * Thrown when file content is not valid text (malformed UTF-8 or binary data).
 */
public class EncodingException extends IOException {

    private final long offset;

    public EncodingException(String message, long offset) {
        super(message);
        this.offset = offset;
    }

    /**
     * Returns the byte offset at which the content stopped being valid text.
     */
    public long getOffset() {
        return offset;
    }
}
