package com.queryroute.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Complexity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
