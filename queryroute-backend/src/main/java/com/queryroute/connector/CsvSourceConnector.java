package com.queryroute.connector;

import com.queryroute.model.SourceDefinition;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Flat-file source: a directory holding one {@code <table>.csv} (or {@code .tsv}) per table.
 * Queries are operation sequences evaluated in memory.
 */
@Slf4j
public class CsvSourceConnector implements SourceConnector {
    private final SourceDefinition source;
    private final Path directory;

    public CsvSourceConnector(SourceDefinition source) {
        if (source.getDirectory() == null || source.getDirectory().isBlank()) {
            throw new IllegalArgumentException("Flat-file source " + source.getId() + " has no directory");
        }
        this.source = source;
        this.directory = Paths.get(source.getDirectory());
    }

    @Override
    public String getSourceId() {
        return source.getId();
    }

    @Override
    public String getDbType() {
        return "csv";
    }

    @Override
    public boolean supportsSql() {
        return false;
    }

    @Override
    public SourceSession connect() {
        if (!Files.isDirectory(directory)) {
            throw new SourceAccessException("Directory not found for source " + source.getId() + ": " + directory);
        }
        log.debug("Opening flat-file session: source_id={}, directory={}", source.getId(), directory);
        return new CsvSourceSession(directory);
    }

    @Override
    public void close() {
        // nothing pooled
    }
}
