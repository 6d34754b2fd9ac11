package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RegionFilterConfig {
    private String field;
    private String regionValue;
    @Builder.Default
    private RegionMatchMode regionType = RegionMatchMode.EXACT;
    @Builder.Default
    private String regionLevel = "province";
}
