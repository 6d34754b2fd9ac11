package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-run settings that override what the instructions declare: reporting window, region, table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EtlTaskContext {
    private String startDate;
    private String endDate;
    private String region;
    private String tableName;

    public boolean hasTimeRange() {
        return (startDate != null && !startDate.isBlank()) || (endDate != null && !endDate.isBlank());
    }

    public boolean hasRegion() {
        return region != null && !region.isBlank();
    }
}
