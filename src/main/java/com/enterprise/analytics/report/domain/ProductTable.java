package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Table;

public final class ProductTable extends Table {

    public static final ProductTable PRODUCTS = new ProductTable("ap");

    public final Column<Long>   ID;
    public final Column<String> NAME;

    public ProductTable(String alias) {
        super("app_products", alias);
        this.ID   = column("id", Long.class);
        this.NAME = column("name", String.class);
    }

    @Override
    public ProductTable as(String newAlias) {
        return new ProductTable(newAlias);
    }
}
