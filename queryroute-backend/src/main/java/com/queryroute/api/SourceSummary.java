package com.queryroute.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.queryroute.model.SourceDefinition;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SourceSummary {
    private String id;
    private String name;
    private String type;
    private String defaultTable;
    private int catalogTables;

    public static SourceSummary of(SourceDefinition source, int catalogTables) {
        return SourceSummary.builder()
                .id(source.getId())
                .name(source.displayName())
                .type(source.getType())
                .defaultTable(source.getDefaultTable())
                .catalogTables(catalogTables)
                .build();
    }
}
