package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative, source-agnostic description of one extraction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EtlInstructions {
    private String instructionId;
    @NotNull(message = "Query type is required")
    private EtlQueryType queryType;
    private String tableName;
    @Builder.Default
    private List<String> sourceFields = new ArrayList<>();
    @Builder.Default
    private List<FilterConfig> filters = new ArrayList<>();
    @Valid
    @Builder.Default
    private List<AggregationConfig> aggregations = new ArrayList<>();
    @Builder.Default
    private List<TransformationConfig> transformations = new ArrayList<>();
    private TimeFilterConfig timeConfig;
    private RegionFilterConfig regionConfig;
    @Builder.Default
    private OutputFormat outputFormat = OutputFormat.DATAFRAME;
    @Builder.Default
    private List<String> performanceHints = new ArrayList<>();

    public AggregationConfig primaryAggregation() {
        return aggregations == null || aggregations.isEmpty() ? null : aggregations.get(0);
    }
}
