package com.queryroute.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AggregationConfig {
    @NotNull(message = "Aggregation function is required")
    private AggregateFunction function;
    @NotBlank(message = "Aggregation field is required")
    private String field;
    private List<String> groupBy;
    private String havingCondition;
    /** Overrides {@link #alias()}; set by the router, never read from requests. */
    @JsonIgnore
    private String outputName;

    /**
     * Output column name of this aggregate, e.g. {@code sum_amount}; {@code count_all} for {@code COUNT(*)}.
     */
    public String alias() {
        if (outputName != null && !outputName.isBlank()) {
            return outputName;
        }
        return function.wireName() + "_" + ("*".equals(field) ? "all" : field);
    }

    public boolean hasGroupBy() {
        return groupBy != null && !groupBy.isEmpty();
    }
}
