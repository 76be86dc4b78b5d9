package com.enterprise.analytics.sql.core;

public class Column<T> implements SqlExpression {

    private final Table table;
    private final String name;
    private final Class<T> type;

    public Column(Table table, String name, Class<T> type) {
        this.table = table;
        this.name = name;
        this.type = type;
    }

    /** Qualified reference: alias.column_name, or the bare name on an unaliased table */
    @Override
    public String ref() {
        return table.prefix() + name;
    }

    /** Qualified reference with an AS alias */
    public String refAs(String alias) {
        return ref() + " AS " + alias;
    }

    @Override
    public String hint() {
        return name;
    }

    public String name() { return name; }
    public Class<T> type() { return type; }
    public Table table() { return table; }

    /** Column = Column expression for ON clauses */
    public String eqColumn(SqlExpression other) {
        return ref() + " = " + other.ref();
    }

    public String countDistinctAs(String alias) { return "COUNT(DISTINCT " + ref() + ") AS " + alias; }
    public String maxAs(String alias)           { return "MAX(" + ref() + ") AS " + alias; }

    @Override
    public String toString() {
        return ref();
    }
}
