package com.queryroute.connector;

import com.queryroute.catalog.SchemaIntrospectionException;
import com.queryroute.model.ColumnDescriptor;

import java.time.Duration;
import java.util.List;

/**
 * An open handle on one source. Not thread-safe; each task opens its own.
 */
public interface SourceSession extends AutoCloseable {

    /**
     * @return table names visible to this session
     * @throws SchemaIntrospectionException when the source cannot be listed
     */
    List<String> listTables();

    /**
     * @param tableName table as returned by {@link #listTables()}
     * @return columns in declaration order; empty when the table does not exist
     * @throws SchemaIntrospectionException when the source cannot be described
     */
    List<ColumnDescriptor> describeTable(String tableName);

    /**
     * Run a query. Failures are reported in the result, never thrown.
     *
     * @param query sql or operation sequence
     * @param limit maximum rows to read, {@code 0} for no cap
     * @param timeout statement timeout, {@code null} for none
     * @return result
     */
    ConnectorResult execute(SourceQuery query, int limit, Duration timeout);

    @Override
    void close();
}
