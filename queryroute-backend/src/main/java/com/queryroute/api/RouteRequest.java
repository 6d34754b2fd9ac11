package com.queryroute.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.queryroute.model.RouteConstraints;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RouteRequest {
    @NotBlank(message = "Request text is required")
    private String request;

    @NotBlank(message = "Source ID is required")
    private String sourceId;

    private List<String> additionalSourceIds = new ArrayList<>();
    private List<String> explicitTables = new ArrayList<>();
    @Positive(message = "max_tables must be positive")
    private Integer maxTables;
    @Positive(message = "timeout_ms must be positive")
    private Long timeoutMs;
    private boolean namesOnly;
    private boolean allowBatching = true;

    public RouteConstraints toConstraints() {
        return RouteConstraints.builder()
                .additionalSourceIds(additionalSourceIds != null ? new ArrayList<>(additionalSourceIds) : new ArrayList<>())
                .explicitTables(explicitTables != null ? new ArrayList<>(explicitTables) : new ArrayList<>())
                .maxTables(maxTables)
                .timeoutMs(timeoutMs)
                .namesOnly(namesOnly)
                .allowBatching(allowBatching)
                .build();
    }
}
