package com.queryroute.execution;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionState {
    RECEIVED,
    SINGLE_SOURCE,
    MULTI_SOURCE,
    EXECUTING,
    MERGING,
    DONE,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
