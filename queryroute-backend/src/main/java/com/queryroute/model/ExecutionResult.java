package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one task, or of a whole request after merging.
 *
 * <p>A failed result never carries data.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionResult {
    private boolean success;
    private TabularData data;
    private long rowCount;
    private long executionTimeMs;
    private String querySql;
    private List<String> errors = new ArrayList<>();
    private Map<String, Object> performanceStats = new LinkedHashMap<>();
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public static ExecutionResult success(TabularData data, String querySql) {
        ExecutionResult result = new ExecutionResult();
        result.setSuccess(true);
        result.setData(data);
        result.setRowCount(data != null ? data.rowCount() : 0);
        result.setQuerySql(querySql);
        return result;
    }

    public static ExecutionResult failure(String querySql, List<String> errors) {
        ExecutionResult result = new ExecutionResult();
        result.setSuccess(false);
        result.setQuerySql(querySql);
        result.setErrors(new ArrayList<>(errors));
        return result;
    }

    public static ExecutionResult failure(String querySql, String error) {
        return failure(querySql, List.of(error != null ? error : "unknown error"));
    }
}
