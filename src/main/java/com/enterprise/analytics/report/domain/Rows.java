package com.enterprise.analytics.report.domain;

import java.util.Map;

/**
 * Column readers for rows returned by the executors. Row maps are keyed
 * case-insensitively by the JDBC adapter.
 */
final class Rows {

    private Rows() {}

    static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : String.valueOf(value);
    }

    static String textOrEmpty(Map<String, Object> row, String column) {
        String value = text(row, column);
        return value == null ? "" : value;
    }

    static double number(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.parseDouble(value.toString());
    }
}
