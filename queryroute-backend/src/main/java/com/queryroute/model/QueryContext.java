package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Structured reading of a free-text request produced by the semantic analyzer.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryContext {
    String originalQuery;
    @Builder.Default
    Set<String> entities = Set.of();
    QueryIntent intent;
    double confidence;
    TimeRange timeRange;
    @Builder.Default
    Map<String, String> filters = Map.of();
    String aggregationFunction;

    public boolean hasTimeRange() {
        return timeRange != null;
    }

    public boolean hasAggregationFunction() {
        return aggregationFunction != null && !aggregationFunction.isBlank();
    }
}
