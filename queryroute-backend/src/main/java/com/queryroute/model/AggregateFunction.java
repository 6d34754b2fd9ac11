package com.queryroute.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AggregateFunction {
    SUM,
    AVG,
    COUNT,
    MIN,
    MAX;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a function name case-insensitively.
     *
     * @param name function name such as {@code sum} or {@code AVG}
     * @return function
     * @throws IllegalArgumentException when the name is not a supported aggregate
     */
    public static AggregateFunction parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("aggregate function is blank");
        }
        return AggregateFunction.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
