package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-supplied limits for one routed request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RouteConstraints {
    /** Sources to federate over in addition to the requested one. */
    @Builder.Default
    private List<String> additionalSourceIds = new ArrayList<>();
    /** When non-empty, only these tables are considered by the matcher. */
    @Builder.Default
    private List<String> explicitTables = new ArrayList<>();
    private Integer maxTables;
    private Long timeoutMs;
    private boolean namesOnly;
    @Builder.Default
    private boolean allowBatching = true;

    public static RouteConstraints defaults() {
        return RouteConstraints.builder().build();
    }
}
