package com.queryroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A post-query transformation.
 *
 * <ul>
 *   <li>{@code cast}: {@code field} to {@code targetType} (integer, float, string, date)</li>
 *   <li>{@code format}: {@code field} through {@code pattern}, {@code {}} marks the value</li>
 *   <li>{@code calculate}: {@code formula} evaluated per row into {@code targetField}</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TransformationConfig {
    private TransformationType type;
    private String field;
    private String targetType;
    private String pattern;
    private String formula;
    private String targetField;
}
