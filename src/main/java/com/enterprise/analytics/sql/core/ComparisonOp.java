package com.enterprise.analytics.sql.core;

public enum ComparisonOp {
    EQ("="), NEQ("<>");

    private final String sql;

    ComparisonOp(String sql) { this.sql = sql; }

    public String sql() { return sql; }
}
