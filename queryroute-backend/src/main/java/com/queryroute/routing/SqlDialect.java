package com.queryroute.routing;

import com.queryroute.util.DbTypeNormalizer;

/**
 * Row-limit and paging clauses per database family.
 */
public enum SqlDialect {
    LIMIT_OFFSET,
    FETCH_FIRST;

    public static SqlDialect forDbType(String dbType) {
        return DbTypeNormalizer.usesFetchFirst(dbType) ? FETCH_FIRST : LIMIT_OFFSET;
    }

    public static boolean hasRowLimit(String sql) {
        return SqlFragments.hasRowLimit(sql);
    }

    public String limit(String sql, int rows) {
        switch (this) {
            case FETCH_FIRST:
                return sql + " FETCH FIRST " + rows + " ROWS ONLY";
            case LIMIT_OFFSET:
            default:
                return sql + " LIMIT " + rows;
        }
    }

    /**
     * Appends a page clause. A query that already limits its rows is wrapped as a derived table first.
     */
    public String page(String sql, long offset, int pageSize) {
        if (hasRowLimit(sql)) {
            sql = "SELECT * FROM (" + sql + ") paged";
        }
        switch (this) {
            case FETCH_FIRST:
                return sql + " OFFSET " + offset + " ROWS FETCH NEXT " + pageSize + " ROWS ONLY";
            case LIMIT_OFFSET:
            default:
                return sql + " LIMIT " + pageSize + " OFFSET " + offset;
        }
    }
}
