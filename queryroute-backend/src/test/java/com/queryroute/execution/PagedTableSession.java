package com.queryroute.execution;

import com.queryroute.connector.ConnectorResult;
import com.queryroute.connector.SourceQuery;
import com.queryroute.connector.SourceSession;
import com.queryroute.model.ColumnDescriptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Serves {@code LIMIT n OFFSET m} pages of a generated single-column table and records every query.
 */
class PagedTableSession implements SourceSession {
    private static final Pattern PAGE = Pattern.compile("LIMIT (\\d+) OFFSET (\\d+)$");

    private final int totalRows;
    private final List<String> queries = new ArrayList<>();
    private int failOnCall = -1;
    private boolean closed;

    PagedTableSession(int totalRows) {
        this.totalRows = totalRows;
    }

    PagedTableSession failOnCall(int call) {
        this.failOnCall = call;
        return this;
    }

    List<String> queries() {
        return queries;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public List<String> listTables() {
        return List.of("t");
    }

    @Override
    public List<ColumnDescriptor> describeTable(String tableName) {
        return List.of(ColumnDescriptor.of("n", "INT"));
    }

    @Override
    public ConnectorResult execute(SourceQuery query, int limit, Duration timeout) {
        queries.add(query.getSql());
        if (queries.size() == failOnCall) {
            return ConnectorResult.failed("connection reset");
        }
        int size = totalRows;
        int offset = 0;
        Matcher m = PAGE.matcher(query.getSql());
        if (m.find()) {
            size = Integer.parseInt(m.group(1));
            offset = Integer.parseInt(m.group(2));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = offset; i < Math.min(totalRows, offset + size); i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("n", i);
            rows.add(row);
        }
        return ConnectorResult.ok(List.of("n"), rows);
    }

    @Override
    public void close() {
        closed = true;
    }
}
