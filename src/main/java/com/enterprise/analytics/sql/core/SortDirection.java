package com.enterprise.analytics.sql.core;

public enum SortDirection {
    ASC, DESC;

    /** Lenient parse: anything other than "asc" (any case) sorts descending. */
    public static SortDirection parse(String value) {
        return value != null && value.equalsIgnoreCase("asc") ? ASC : DESC;
    }
}
