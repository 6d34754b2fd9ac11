package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured plan for one request. Built once, never mutated.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryPlan {
    String sourceId;
    @Builder.Default
    List<TableCandidate> primaryTables = List.of();
    @Builder.Default
    List<TableCandidate> joinTables = List.of();
    @Builder.Default
    List<String> joinConditions = List.of();
    @Builder.Default
    List<String> whereConditions = List.of();
    /** The same predicates as {@code whereConditions}, as column filters for sources without SQL. */
    @Builder.Default
    List<FilterConfig> filters = List.of();
    @Builder.Default
    List<String> selectColumns = List.of();
    @Builder.Default
    List<String> groupByColumns = List.of();
    @Builder.Default
    List<String> orderByColumns = List.of();
    Complexity complexity;
    boolean crossDatabase;
    @Builder.Default
    List<String> executionOrder = List.of();
    boolean fallback;
    String placeholderTable;

    public List<TableCandidate> allTables() {
        List<TableCandidate> all = new ArrayList<>(primaryTables);
        all.addAll(joinTables);
        return all;
    }

    public Set<String> distinctSourceIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (TableCandidate candidate : allTables()) {
            ids.add(candidate.getSourceId());
        }
        return ids;
    }
}
