package com.queryroute.model;

import lombok.Value;

/**
 * Time window recognized in free text.
 *
 * <p>{@code label} and {@code amount} identify the window; the expressions are the matched MySQL-style
 * templates, used as-is only for labels the planner cannot resolve to fixed bounds.
 */
@Value
public class TimeRange {
    String label;
    String startExpression;
    String endExpression;
    /** Captured count for {@code last_n_*} windows, otherwise null. */
    Integer amount;
}
