package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal artifact of the ETL path.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProcessedData {
    private boolean success;
    private TabularData rawData;
    private Object processedValue;
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private long processingTimeMs;
    private double confidence;
    private String queryExecuted;
    private long rowsProcessed;
    private String error;
}
