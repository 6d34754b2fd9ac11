package com.queryroute.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * One registered data source as declared in the sources YAML.
 *
 * <p>Field names mirror the YAML keys so SnakeYAML {@code loadAs} can bind them directly.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SourceDefinition {
    private String id;
    private String name;
    private String type;
    @JsonIgnore
    private String dsn;
    @JsonIgnore
    private String jdbcUrl;
    private String username;
    @JsonIgnore
    private String password;
    private String schema;
    private String defaultTable;
    /** Directory holding one {@code <table>.csv} per table, for flat-file sources. */
    private String directory;
    @JsonIgnore
    private CatalogDefinition catalog;

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
