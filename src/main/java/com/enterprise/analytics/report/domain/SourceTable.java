package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Table;

public final class SourceTable extends Table {

    public static final SourceTable SOURCES = new SourceTable("sr");

    public final Column<Long>   ID;
    public final Column<String> SOURCE;

    public SourceTable(String alias) {
        super("source", alias);
        this.ID     = column("id", Long.class);
        this.SOURCE = column("source", String.class);
    }

    @Override
    public SourceTable as(String newAlias) {
        return new SourceTable(newAlias);
    }
}
