package com.queryroute.catalog;

import com.queryroute.model.CatalogDefinition;
import com.queryroute.model.CatalogTableDefinition;
import com.queryroute.model.SourceDefinition;
import com.queryroute.model.SourcesFile;
import com.queryroute.model.TableDescriptor;
import com.queryroute.util.DbTypeNormalizer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered data sources, loaded from YAML. Declared catalogs are pushed into the {@link MetadataCatalog}.
 */
@Component
public class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final ResourceLoader resourceLoader;
    private final MetadataCatalog catalog;
    private final String sourcesPath;

    private volatile Map<String, SourceDefinition> sources = new LinkedHashMap<>();

    public SourceRegistry(
            ResourceLoader resourceLoader,
            MetadataCatalog catalog,
            @Value("${queryroute.sources.path:classpath:sources.yaml}") String sourcesPath
    ) {
        this.resourceLoader = resourceLoader;
        this.catalog = catalog;
        this.sourcesPath = sourcesPath;
    }

    @PostConstruct
    public void loadSources() {
        reload();
    }

    /**
     * Re-reads the sources file and swaps the registry in one step.
     */
    public synchronized void reload() {
        Map<String, SourceDefinition> loaded = new LinkedHashMap<>();
        Resource resource = resourceLoader.getResource(sourcesPath);
        if (!resource.exists()) {
            log.warn("Sources file not found: {}", sourcesPath);
            sources = loaded;
            return;
        }

        SourcesFile file;
        try (InputStream in = resource.getInputStream()) {
            file = new Yaml().loadAs(in, SourcesFile.class);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load sources file " + sourcesPath + ": " + e.getMessage(), e);
        }

        if (file != null && file.getSources() != null) {
            for (SourceDefinition source : file.getSources()) {
                validate(source);
                if (loaded.putIfAbsent(source.getId(), source) != null) {
                    throw new IllegalStateException("Duplicate source id in " + sourcesPath + ": " + source.getId());
                }
            }
        }

        for (String removed : sources.keySet()) {
            if (!loaded.containsKey(removed)) {
                catalog.remove(removed);
            }
        }
        sources = loaded;
        loaded.values().forEach(this::seedCatalog);
        log.info("Loaded {} data sources from {}", loaded.size(), sourcesPath);
    }

    /**
     * Registers (or replaces) one source at runtime.
     */
    public synchronized void register(SourceDefinition source) {
        validate(source);
        Map<String, SourceDefinition> copy = new LinkedHashMap<>(sources);
        copy.put(source.getId(), source);
        sources = copy;
        seedCatalog(source);
    }

    public Optional<SourceDefinition> find(String sourceId) {
        return Optional.ofNullable(sourceId).map(sources::get);
    }

    /**
     * @throws SourceNotFoundException when the id is not registered
     */
    public SourceDefinition require(String sourceId) {
        return find(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
    }

    public Collection<SourceDefinition> all() {
        return sources.values();
    }

    private void validate(SourceDefinition source) {
        if (source.getId() == null || source.getId().isBlank()) {
            throw new IllegalStateException("Source without id in " + sourcesPath);
        }
        if (source.getType() == null || source.getType().isBlank()) {
            throw new IllegalStateException("Source " + source.getId() + " has no type");
        }
        source.setType(DbTypeNormalizer.normalize(source.getType()));
        if (DbTypeNormalizer.isFlatFile(source.getType())) {
            if (source.getDirectory() == null || source.getDirectory().isBlank()) {
                throw new IllegalStateException("Flat-file source " + source.getId() + " has no directory");
            }
        } else if (isBlank(source.getDsn()) && isBlank(source.getJdbcUrl())) {
            throw new IllegalStateException("Source " + source.getId() + " needs a dsn or jdbcUrl");
        }
    }

    private void seedCatalog(SourceDefinition source) {
        CatalogDefinition declared = source.getCatalog();
        if (declared == null || declared.getTables() == null || declared.getTables().isEmpty()) {
            return;
        }
        List<TableDescriptor> tables = new ArrayList<>();
        for (CatalogTableDefinition table : declared.getTables()) {
            tables.add(table.toDescriptor(source));
        }
        catalog.replace(source.getId(), tables, declared.getRelations() != null ? declared.getRelations() : List.of());
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
