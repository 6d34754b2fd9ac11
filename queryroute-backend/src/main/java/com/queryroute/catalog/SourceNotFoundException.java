package com.queryroute.catalog;

/**
 * Thrown when a request names a source id that is not registered.
 */
public class SourceNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param sourceId unknown source id
     */
    public SourceNotFoundException(String sourceId) {
        super("Data source not found: " + sourceId);
    }
}
