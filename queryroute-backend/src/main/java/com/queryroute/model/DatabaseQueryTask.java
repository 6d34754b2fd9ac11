package com.queryroute.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.queryroute.connector.OperationStep;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One rendered query bound to one source. Priority 1 is the most urgent, 3 the least.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DatabaseQueryTask {
    private String sourceId;
    private String sourceName;
    private String sourceType;
    @Builder.Default
    private List<TableCandidate> tables = List.of();
    private String sql;
    /** Set instead of {@link #sql} for sources that do not run SQL. */
    @Builder.Default
    private List<OperationStep> operations = List.of();
    @Builder.Default
    private int priority = 1;
    private double estimatedCost;

    @JsonIgnore
    public boolean isOperationSequence() {
        return sql == null && operations != null && !operations.isEmpty();
    }

    /**
     * The query as recorded in results: the SQL text, or the operation steps joined by {@code |}.
     */
    public String queryText() {
        if (!isOperationSequence()) {
            return sql;
        }
        return operations.stream().map(OperationStep::describe).collect(Collectors.joining(" | "));
    }

    public long totalRowCount() {
        return tables.stream().mapToLong(t -> Math.max(0, t.getTable().getRowCount())).sum();
    }
}
