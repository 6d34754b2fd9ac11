package com.queryroute.connector;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A query for one source: either SQL text or a declarative operation sequence.
 */
@Getter
@EqualsAndHashCode
public final class SourceQuery {
    private final String sql;
    private final List<OperationStep> operations;

    private SourceQuery(String sql, List<OperationStep> operations) {
        this.sql = sql;
        this.operations = operations;
    }

    public static SourceQuery sql(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("SQL text is required");
        }
        return new SourceQuery(sql, List.of());
    }

    public static SourceQuery operations(List<OperationStep> operations) {
        if (operations == null || operations.isEmpty() || operations.get(0).getType() != OperationType.LOAD) {
            throw new IllegalArgumentException("Operation sequence must start with LOAD");
        }
        return new SourceQuery(null, List.copyOf(operations));
    }

    public boolean isSql() {
        return sql != null;
    }

    /**
     * Returns a copy of this operation sequence with extra steps appended.
     *
     * @param steps steps to append
     * @return new query
     */
    public SourceQuery withSteps(OperationStep... steps) {
        if (isSql()) {
            throw new IllegalStateException("Cannot append operation steps to a SQL query");
        }
        List<OperationStep> extended = new ArrayList<>(operations);
        extended.addAll(List.of(steps));
        return new SourceQuery(null, List.copyOf(extended));
    }

    /**
     * Human-readable text recorded as the executed query.
     */
    public String describe() {
        if (isSql()) {
            return sql;
        }
        return operations.stream().map(OperationStep::describe).collect(Collectors.joining(" | "));
    }

    @Override
    public String toString() {
        return describe();
    }
}
