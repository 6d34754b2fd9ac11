package com.queryroute.catalog;

/**
 * Transient failure while listing or describing tables of a live source.
 */
public class SchemaIntrospectionException extends RuntimeException {
    public SchemaIntrospectionException(String message) {
        super(message);
    }

    public SchemaIntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
