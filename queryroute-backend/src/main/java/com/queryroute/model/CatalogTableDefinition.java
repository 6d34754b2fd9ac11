package com.queryroute.model;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
public class CatalogTableDefinition {
    private String name;
    private String schema;
    private String displayName;
    private List<String> businessTags = new ArrayList<>();
    private Long rowCount;
    /** ISO-8601 instant, e.g. {@code 2026-01-31T00:00:00Z}. */
    private String lastAnalyzed;
    private String sensitivity;
    private List<ColumnDescriptor> columns = new ArrayList<>();

    public TableDescriptor toDescriptor(SourceDefinition source) {
        return TableDescriptor.builder()
                .sourceId(source.getId())
                .sourceName(source.displayName())
                .schema(schema != null ? schema : source.getSchema())
                .name(name)
                .displayName(displayName)
                .businessTags(businessTags != null ? List.copyOf(businessTags) : List.of())
                .rowCount(rowCount != null ? rowCount : 0L)
                .lastAnalyzed(lastAnalyzed != null && !lastAnalyzed.isBlank() ? Instant.parse(lastAnalyzed) : null)
                .sensitivity(sensitivity)
                .columns(columns != null ? List.copyOf(columns) : List.of())
                .build();
    }
}
