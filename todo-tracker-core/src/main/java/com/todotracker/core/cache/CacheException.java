package com.todotracker.core.cache;

/**
 * Thrown when the fingerprint store cannot be read or written.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }

    public CacheException(String message) {
        super(message);
    }
}
