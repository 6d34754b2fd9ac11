package com.queryroute.catalog;

import com.queryroute.connector.SourceSession;
import com.queryroute.model.ColumnDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Live introspection with retry and exponential backoff for transient failures.
 */
@Slf4j
@Component
public class SchemaIntrospector {
    private final int maxAttempts;
    private final long initialBackoffMs;

    public SchemaIntrospector(
            @Value("${queryroute.introspection.max-attempts:3}") int maxAttempts,
            @Value("${queryroute.introspection.initial-backoff-ms:100}") long initialBackoffMs
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("introspection max-attempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoffMs;
    }

    /**
     * @throws SchemaIntrospectionException after the last attempt failed
     */
    public List<String> listTables(SourceSession session) {
        return withRetry("list tables", session::listTables);
    }

    /**
     * Describe a table; a table that keeps failing is treated as having no columns.
     */
    public List<ColumnDescriptor> describeOrEmpty(SourceSession session, String tableName) {
        try {
            return withRetry("describe " + tableName, () -> session.describeTable(tableName));
        } catch (SchemaIntrospectionException e) {
            log.warn("Giving up on table: table={}, attempts={}, error={}", tableName, maxAttempts, e.getMessage());
            return List.of();
        }
    }

    <T> T withRetry(String operation, Supplier<T> call) {
        long backoff = initialBackoffMs;
        SchemaIntrospectionException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (SchemaIntrospectionException e) {
                last = e;
                log.debug("Introspection failed: operation={}, attempt={}/{}, error={}", operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    sleep(backoff);
                    backoff *= 2;
                }
            }
        }
        throw last;
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchemaIntrospectionException("Interrupted while waiting to retry", e);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
