package com.queryroute.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column names plus ordered rows keyed by column name.
 */
@Data
@NoArgsConstructor
public class TabularData {
    private List<String> columns = new ArrayList<>();
    private List<Map<String, Object>> rows = new ArrayList<>();

    public TabularData(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = new ArrayList<>(columns);
        this.rows = new ArrayList<>(rows);
    }

    public static TabularData empty() {
        return new TabularData();
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public void addRow(Map<String, Object> row) {
        rows.add(row);
    }

    /**
     * Appends the rows of another result with the same or a compatible column layout.
     *
     * @param other page or batch to append
     */
    public void append(TabularData other) {
        for (String column : other.getColumns()) {
            if (!columns.contains(column)) {
                columns.add(column);
            }
        }
        rows.addAll(other.getRows());
    }

    public Object cell(int rowIndex, String column) {
        return rows.get(rowIndex).get(column);
    }

    public static Map<String, Object> row(Object... keysAndValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            row.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return row;
    }
}
