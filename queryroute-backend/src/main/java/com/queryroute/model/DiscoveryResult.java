package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DiscoveryResult {
    private String sourceId;
    private boolean success;
    private int tablesFound;
    private int columnsFound;
    private int relationsFound;
    private List<String> errors = new ArrayList<>();
    private long discoveryTimeMs;
}
