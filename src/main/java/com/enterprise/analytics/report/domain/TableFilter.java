package com.enterprise.analytics.report.domain;

import java.util.Objects;

/**
 * A user-typed filter: {@code field} is a dimension id, {@code value} is compared
 * case-insensitively. A null value is treated as empty.
 */
public record TableFilter(String field, FilterOperator operator, String value) {

    public TableFilter {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        value = value == null ? "" : value;
    }

    public static TableFilter of(String field, FilterOperator operator, String value) {
        return new TableFilter(field, operator, value);
    }
}
