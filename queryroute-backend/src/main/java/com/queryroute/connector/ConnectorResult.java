package com.queryroute.connector;

import com.queryroute.model.TabularData;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Raw outcome of one {@link SourceSession#execute} call.
 */
@Data
@Builder
public class ConnectorResult {
    private boolean success;
    @Builder.Default
    private List<String> columns = new ArrayList<>();
    @Builder.Default
    private List<Map<String, Object>> rows = new ArrayList<>();
    private boolean truncated;
    private String error;

    public static ConnectorResult ok(List<String> columns, List<Map<String, Object>> rows) {
        return ConnectorResult.builder().success(true).columns(columns).rows(rows).build();
    }

    public static ConnectorResult failed(String error) {
        return ConnectorResult.builder().success(false).error(error).build();
    }

    public TabularData toTabularData() {
        return new TabularData(columns, rows);
    }
}
