package com.queryroute.connector;

/**
 * Thrown when a source cannot be opened (bad descriptor, unreachable host, missing directory).
 */
public class SourceAccessException extends RuntimeException {
    public SourceAccessException(String message) {
        super(message);
    }

    public SourceAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
