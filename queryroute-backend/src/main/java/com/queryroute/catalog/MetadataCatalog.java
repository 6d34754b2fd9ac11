package com.queryroute.catalog;

import com.queryroute.model.TableDescriptor;
import com.queryroute.model.TableRelation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory table catalog per source. Each source's entry is replaced atomically.
 */
@Slf4j
@Component
public class MetadataCatalog {

    private static final SourceCatalog EMPTY = new SourceCatalog(List.of(), List.of());

    private final Map<String, SourceCatalog> catalogs = new ConcurrentHashMap<>();

    private record SourceCatalog(List<TableDescriptor> tables, List<TableRelation> relations) {
    }

    public void replace(String sourceId, List<TableDescriptor> tables, List<TableRelation> relations) {
        catalogs.put(sourceId, new SourceCatalog(List.copyOf(tables), List.copyOf(relations)));
        log.info("Catalog updated: source_id={}, tables={}, relations={}", sourceId, tables.size(), relations.size());
    }

    public void remove(String sourceId) {
        catalogs.remove(sourceId);
    }

    public List<TableDescriptor> tables(String sourceId) {
        return catalogs.getOrDefault(sourceId, EMPTY).tables();
    }

    public List<TableRelation> relations(String sourceId) {
        return catalogs.getOrDefault(sourceId, EMPTY).relations();
    }

    public Optional<TableDescriptor> table(String sourceId, String tableName) {
        return tables(sourceId).stream()
                .filter(t -> t.getName().equalsIgnoreCase(tableName))
                .findFirst();
    }

    /**
     * @return the declared relation linking the two tables of one source, in either direction
     */
    public Optional<TableRelation> findRelation(String sourceId, String tableA, String tableB) {
        return relations(sourceId).stream()
                .filter(r -> r.connects(tableA, tableB))
                .findFirst();
    }
}
