package com.enterprise.analytics.report.domain;

public enum FilterOperator {
    EQUALS(false),
    NOT_EQUALS(true),
    CONTAINS(false),
    NOT_CONTAINS(true);

    private final boolean negated;

    FilterOperator(boolean negated) {
        this.negated = negated;
    }

    public boolean isNegated() { return negated; }

    /** Whether an empty value means "IS [NOT] NULL" for this operator. */
    public boolean acceptsEmptyValue() {
        return this == EQUALS || this == NOT_EQUALS;
    }
}
