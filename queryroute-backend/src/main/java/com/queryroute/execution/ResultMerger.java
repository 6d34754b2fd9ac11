package com.queryroute.execution;

import com.queryroute.model.TabularData;
import com.queryroute.util.Values;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-source results into one table.
 *
 * <p>Two results sharing column names are full-outer-joined on all of them; results with no shared
 * column are concatenated over the union of columns.
 */
public final class ResultMerger {

    private ResultMerger() {
    }

    public static TabularData merge(List<TabularData> results) {
        if (results.isEmpty()) {
            return TabularData.empty();
        }
        TabularData merged = results.get(0);
        for (int i = 1; i < results.size(); i++) {
            merged = mergePair(merged, results.get(i));
        }
        return merged;
    }

    static TabularData mergePair(TabularData left, TabularData right) {
        List<String> shared = new ArrayList<>();
        for (String column : left.getColumns()) {
            if (right.getColumns().contains(column)) {
                shared.add(column);
            }
        }
        List<String> columns = new ArrayList<>(left.getColumns());
        for (String column : right.getColumns()) {
            if (!columns.contains(column)) {
                columns.add(column);
            }
        }
        if (shared.isEmpty()) {
            return concatenate(left, right, columns);
        }
        return fullOuterJoin(left, right, shared, columns);
    }

    private static TabularData concatenate(TabularData left, TabularData right, List<String> columns) {
        List<Map<String, Object>> rows = new ArrayList<>(left.rowCount() + right.rowCount());
        for (Map<String, Object> row : left.getRows()) {
            rows.add(project(row, columns));
        }
        for (Map<String, Object> row : right.getRows()) {
            rows.add(project(row, columns));
        }
        return new TabularData(columns, rows);
    }

    private static TabularData fullOuterJoin(TabularData left, TabularData right, List<String> shared, List<String> columns) {
        Map<List<Object>, List<Integer>> rightIndex = new HashMap<>();
        for (int i = 0; i < right.rowCount(); i++) {
            List<Object> key = key(right.getRows().get(i), shared);
            if (key != null) {
                rightIndex.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
        }

        boolean[] rightMatched = new boolean[right.rowCount()];
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> leftRow : left.getRows()) {
            List<Object> key = key(leftRow, shared);
            List<Integer> matches = key != null ? rightIndex.getOrDefault(key, List.of()) : List.of();
            if (matches.isEmpty()) {
                rows.add(project(leftRow, columns));
                continue;
            }
            for (int idx : matches) {
                rightMatched[idx] = true;
                Map<String, Object> row = project(leftRow, columns);
                for (Map.Entry<String, Object> cell : right.getRows().get(idx).entrySet()) {
                    if (!shared.contains(cell.getKey())) {
                        row.put(cell.getKey(), cell.getValue());
                    }
                }
                rows.add(row);
            }
        }
        for (int i = 0; i < right.rowCount(); i++) {
            if (!rightMatched[i]) {
                rows.add(project(right.getRows().get(i), columns));
            }
        }
        return new TabularData(columns, rows);
    }

    // null when any key cell is null: such rows never join
    private static List<Object> key(Map<String, Object> row, List<String> shared) {
        List<Object> key = new ArrayList<>(shared.size());
        for (String column : shared) {
            Object v = row.get(column);
            if (v == null) {
                return null;
            }
            key.add(Values.joinKey(v));
        }
        return key;
    }

    private static Map<String, Object> project(Map<String, Object> row, List<String> columns) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String column : columns) {
            out.put(column, row.get(column));
        }
        return out;
    }
}
