package com.queryroute.connector;

public enum OperationType {
    LOAD,
    FILTER,
    AGGREGATE,
    SELECT,
    ORDER_BY,
    OFFSET,
    LIMIT
}
