package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Catalog entry for one table of one registered source.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TableDescriptor {
    String sourceId;
    String sourceName;
    String schema;
    String name;
    String displayName;
    @Builder.Default
    List<String> businessTags = List.of();
    long rowCount;
    Instant lastAnalyzed;
    String sensitivity;
    @Builder.Default
    List<ColumnDescriptor> columns = List.of();

    /**
     * Name used in FROM clauses: {@code schema.name} when a schema is known.
     *
     * @return qualified table name
     */
    public String qualifiedName() {
        if (schema == null || schema.isBlank()) {
            return name;
        }
        return schema + "." + name;
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDescriptor::getName).filter(Objects::nonNull).toList();
    }

    public boolean hasColumn(String columnName) {
        return columnName != null && columnNames().stream().anyMatch(columnName::equalsIgnoreCase);
    }
}
