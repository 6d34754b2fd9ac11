package com.queryroute.connector;

import com.queryroute.catalog.SourceRegistry;
import com.queryroute.model.SourceDefinition;
import com.queryroute.util.DbTypeNormalizer;
import com.queryroute.util.JdbcConnectionInfoResolver;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates one connector per registered source on first use and keeps it until shutdown.
 */
@Slf4j
@Component
public class RegistrySourceConnectorProvider implements SourceConnectorProvider {
    private final Map<String, SourceConnector> connectors = new ConcurrentHashMap<>();

    private final SourceRegistry registry;
    private final JdbcConnectionInfoResolver connectionInfoResolver;
    private final JdbcPoolSettings poolSettings;

    public RegistrySourceConnectorProvider(
            SourceRegistry registry,
            JdbcConnectionInfoResolver connectionInfoResolver,
            @Value("${queryroute.jdbc.maximum-pool-size:5}") int maximumPoolSize,
            @Value("${queryroute.jdbc.connection-timeout-ms:5000}") long connectionTimeoutMs
    ) {
        this.registry = registry;
        this.connectionInfoResolver = connectionInfoResolver;
        this.poolSettings = JdbcPoolSettings.builder()
                .maximumPoolSize(maximumPoolSize)
                .connectionTimeoutMs(connectionTimeoutMs)
                .build();
    }

    @Override
    public SourceConnector connectorFor(String sourceId) {
        SourceDefinition source = registry.require(sourceId);
        return connectors.computeIfAbsent(sourceId, id -> create(source));
    }

    private SourceConnector create(SourceDefinition source) {
        if (DbTypeNormalizer.isFlatFile(source.getType())) {
            return new CsvSourceConnector(source);
        }
        return new JdbcSourceConnector(source, connectionInfoResolver.resolve(source), poolSettings);
    }

    /**
     * Drops the cached connector so the next lookup picks up a changed definition.
     */
    public void evict(String sourceId) {
        SourceConnector removed = connectors.remove(sourceId);
        if (removed != null) {
            removed.close();
        }
    }

    @PreDestroy
    public void closeAll() {
        connectors.forEach((id, connector) -> {
            try {
                connector.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close connector: source_id={}, error={}", id, e.getMessage());
            }
        });
        connectors.clear();
    }
}
