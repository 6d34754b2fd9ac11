package com.queryroute.connector;

import com.queryroute.catalog.SchemaIntrospectionException;
import com.queryroute.model.ColumnDescriptor;
import com.queryroute.util.JdbcJsonSafe;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Slf4j
class JdbcSourceSession implements SourceSession {
    private static final Set<String> SYSTEM_SCHEMAS = Set.of(
            "information_schema", "pg_catalog", "sys", "mysql", "performance_schema");

    private final Connection conn;
    private final String schema;

    JdbcSourceSession(Connection conn, String schema) {
        this.conn = conn;
        this.schema = schema != null && !schema.isBlank() ? schema : null;
    }

    @Override
    public List<String> listTables() {
        List<String> tables = new ArrayList<>();
        try (ResultSet rs = conn.getMetaData().getTables(null, schema, "%", null)) {
            while (rs.next()) {
                String tableSchema = rs.getString("TABLE_SCHEM");
                String tableType = rs.getString("TABLE_TYPE");
                if (tableSchema != null && SYSTEM_SCHEMAS.contains(tableSchema.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                if (tableType != null && !isUserTableType(tableType)) {
                    continue;
                }
                tables.add(rs.getString("TABLE_NAME"));
            }
        } catch (SQLException e) {
            throw new SchemaIntrospectionException("Failed to list tables: " + e.getMessage(), e);
        }
        tables.sort(String.CASE_INSENSITIVE_ORDER);
        return tables;
    }

    private static boolean isUserTableType(String tableType) {
        String t = tableType.toUpperCase(Locale.ROOT);
        return t.equals("TABLE") || t.equals("BASE TABLE") || t.equals("VIEW");
    }

    @Override
    public List<ColumnDescriptor> describeTable(String tableName) {
        try {
            DatabaseMetaData meta = conn.getMetaData();
            List<ColumnDescriptor> columns = readColumns(meta, tableName);
            if (columns.isEmpty()) {
                // unquoted identifiers are folded differently per database
                String folded = meta.storesUpperCaseIdentifiers()
                        ? tableName.toUpperCase(Locale.ROOT)
                        : tableName.toLowerCase(Locale.ROOT);
                if (!folded.equals(tableName)) {
                    columns = readColumns(meta, folded);
                }
            }
            return columns;
        } catch (SQLException e) {
            throw new SchemaIntrospectionException("Failed to describe table " + tableName + ": " + e.getMessage(), e);
        }
    }

    private List<ColumnDescriptor> readColumns(DatabaseMetaData meta, String tableName) throws SQLException {
        List<ColumnDescriptor> columns = new ArrayList<>();
        try (ResultSet rs = meta.getColumns(null, schema, tableName, "%")) {
            while (rs.next()) {
                String tableSchema = rs.getString("TABLE_SCHEM");
                if (tableSchema != null && SYSTEM_SCHEMAS.contains(tableSchema.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                String remarks = rs.getString("REMARKS");
                columns.add(ColumnDescriptor.builder()
                        .name(rs.getString("COLUMN_NAME"))
                        .displayName(remarks != null && !remarks.isBlank() ? remarks : null)
                        .dataType(rs.getString("TYPE_NAME"))
                        .build());
            }
        }
        return columns;
    }

    @Override
    public ConnectorResult execute(SourceQuery query, int limit, Duration timeout) {
        if (!query.isSql()) {
            return ConnectorResult.failed("SQL source cannot run operation sequences");
        }
        try (Statement stmt = conn.createStatement()) {
            if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
                stmt.setQueryTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
            }
            if (limit > 0) {
                stmt.setMaxRows(limit + 1);
            }
            boolean hasResultSet = stmt.execute(query.getSql());
            if (!hasResultSet) {
                return ConnectorResult.failed("Statement returned no result set");
            }
            try (ResultSet rs = stmt.getResultSet()) {
                return processResultSet(rs, limit);
            }
        } catch (SQLException e) {
            log.warn("Query failed: sql_state={}, error_code={}, message={}", e.getSQLState(), e.getErrorCode(), e.getMessage());
            return ConnectorResult.failed(e.getMessage());
        }
    }

    private ConnectorResult processResultSet(ResultSet rs, int limit) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(rsmd.getColumnLabel(i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (limit > 0 && rows.size() >= limit) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1), JdbcJsonSafe.read(rs, i));
            }
            rows.add(row);
        }
        return ConnectorResult.builder()
                .success(true)
                .columns(columns)
                .rows(rows)
                .truncated(truncated)
                .build();
    }

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to return connection to pool: {}", e.getMessage());
        }
    }
}
