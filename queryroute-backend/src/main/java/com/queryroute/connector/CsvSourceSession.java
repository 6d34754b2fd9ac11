package com.queryroute.connector;

import com.queryroute.catalog.SchemaIntrospectionException;
import com.queryroute.model.ColumnDescriptor;
import com.queryroute.model.TabularData;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

@Slf4j
class CsvSourceSession implements SourceSession {
    private final Path directory;
    private final Map<String, TabularData> loaded = new HashMap<>();

    CsvSourceSession(Path directory) {
        this.directory = directory;
    }

    @Override
    public List<String> listTables() {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(".csv") || n.endsWith(".tsv"))
                    .map(n -> n.substring(0, n.length() - 4))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new SchemaIntrospectionException("Failed to list " + directory + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ColumnDescriptor> describeTable(String tableName) {
        if (resolve(tableName).isEmpty()) {
            return List.of();
        }
        try {
            return CsvTableReader.describe(load(tableName));
        } catch (UncheckedIOException e) {
            throw new SchemaIntrospectionException("Failed to read " + tableName + ": " + e.getCause().getMessage(), e);
        }
    }

    @Override
    public ConnectorResult execute(SourceQuery query, int limit, Duration timeout) {
        if (query.isSql()) {
            return ConnectorResult.failed("Flat-file source cannot run SQL; use an operation sequence");
        }
        try {
            TabularData data = new OperationSequenceEvaluator(this::load).evaluate(query.getOperations());
            List<Map<String, Object>> rows = data.getRows();
            boolean truncated = false;
            if (limit > 0 && rows.size() > limit) {
                rows = new ArrayList<>(rows.subList(0, limit));
                truncated = true;
            }
            return ConnectorResult.builder()
                    .success(true)
                    .columns(data.getColumns())
                    .rows(rows)
                    .truncated(truncated)
                    .build();
        } catch (IllegalArgumentException | UncheckedIOException e) {
            log.warn("Operation sequence failed: query={}, error={}", query.describe(), e.getMessage());
            return ConnectorResult.failed(e.getMessage());
        }
    }

    private TabularData load(String tableName) {
        return loaded.computeIfAbsent(tableName, name -> {
            Path file = resolve(name).orElseThrow(() -> new IllegalArgumentException("Unknown table: " + name));
            try {
                return CsvTableReader.read(file);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private Optional<Path> resolve(String tableName) {
        for (String ext : List.of(".csv", ".tsv")) {
            Path file = directory.resolve(tableName + ext);
            if (Files.isRegularFile(file)) {
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        loaded.clear();
    }
}
