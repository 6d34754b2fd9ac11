package com.queryroute.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-populated catalog of a source, declared next to the source in YAML.
 */
@Data
public class CatalogDefinition {
    private List<CatalogTableDefinition> tables = new ArrayList<>();
    private List<TableRelation> relations = new ArrayList<>();
}
