package com.queryroute.connector;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.queryroute.model.ColumnDescriptor;
import com.queryroute.model.TabularData;
import com.queryroute.util.Values;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one delimited file with a header row. {@code .tsv} files are tab separated.
 */
final class CsvTableReader {
    private static final int TYPE_SAMPLE_ROWS = 100;

    private CsvTableReader() {
    }

    static TabularData read(Path file) throws IOException {
        try (CSVReader reader = open(file)) {
            String[] header = reader.readNext();
            if (header == null) {
                return TabularData.empty();
            }
            List<String> columns = Arrays.stream(header).map(String::trim).toList();
            List<Map<String, Object>> rows = new ArrayList<>();
            String[] line;
            while ((line = reader.readNext()) != null) {
                if (line.length == 1 && line[0].isBlank()) {
                    continue;
                }
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), i < line.length ? Values.parseCell(line[i]) : null);
                }
                rows.add(row);
            }
            return new TabularData(columns, rows);
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV file " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Column types are inferred from the first rows: all-numeric columns are {@code NUMERIC},
     * ISO dates {@code DATE}, everything else {@code VARCHAR}.
     */
    static List<ColumnDescriptor> describe(TabularData data) {
        List<ColumnDescriptor> columns = new ArrayList<>();
        List<Map<String, Object>> sample = data.getRows().subList(0, Math.min(TYPE_SAMPLE_ROWS, data.rowCount()));
        for (String column : data.getColumns()) {
            columns.add(ColumnDescriptor.of(column, inferType(column, sample)));
        }
        return columns;
    }

    private static String inferType(String column, List<Map<String, Object>> sample) {
        boolean numeric = true;
        boolean date = true;
        boolean seen = false;
        for (Map<String, Object> row : sample) {
            Object v = row.get(column);
            if (v == null) {
                continue;
            }
            seen = true;
            numeric &= v instanceof Number;
            date &= v instanceof String s && s.matches("\\d{4}-\\d{2}-\\d{2}.*");
        }
        if (!seen) {
            return "VARCHAR";
        }
        return numeric ? "NUMERIC" : date ? "DATE" : "VARCHAR";
    }

    private static CSVReader open(Path file) throws IOException {
        if (file.getFileName().toString().endsWith(".tsv")) {
            return new CSVReaderBuilder(Files.newBufferedReader(file, StandardCharsets.UTF_8))
                    .withCSVParser(new CSVParserBuilder().withSeparator('\t').build())
                    .build();
        }
        return new CSVReaderBuilder(Files.newBufferedReader(file, StandardCharsets.UTF_8)).build();
    }
}
