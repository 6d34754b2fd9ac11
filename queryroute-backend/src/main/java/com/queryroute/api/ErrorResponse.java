package com.queryroute.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Body of every failed API call. The trace id matches the {@code X-Request-Id} response header.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {
    int status;
    /** Stable machine-readable code such as {@code SOURCE_NOT_FOUND}. */
    String code;
    String message;
    String details;
    /** One entry per rejected part of ETL instructions. */
    List<String> problems;
    String traceId;

    public static ErrorResponseBuilder of(String code, String message) {
        return builder().code(code).message(message);
    }
}
