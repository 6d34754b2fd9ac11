package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A table scored as potentially relevant to a {@link QueryContext}.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TableCandidate {
    TableDescriptor table;
    double relevanceScore;
    @Builder.Default
    List<String> matchingColumns = List.of();
    String businessContext;
    @Builder.Default
    List<String> requiredJoins = List.of();

    public String getTableName() {
        return table.getName();
    }

    public String getSourceId() {
        return table.getSourceId();
    }
}
