package com.enterprise.analytics.sql.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all table definitions. Each subclass represents a single DB table
 * and serves as the single source of truth for column names and types.
 *
 * <p>Tables support aliasing via {@link #as(String)}. An empty alias produces an
 * unqualified table: the declaration is the bare table name and every column
 * renders without a prefix. Report queries use that form when the event table is
 * the only source in the FROM clause.</p>
 *
 * <p>Example:
 * <pre>{@code
 * public final class ProductTable extends Table {
 *     public static final ProductTable PRODUCTS = new ProductTable("ap");
 *
 *     public final Column<Long> ID;
 *     public final Column<String> NAME;
 *
 *     public ProductTable(String alias) {
 *         super("app_products", alias);
 *         this.ID = column("id", Long.class);
 *         this.NAME = column("name", String.class);
 *     }
 *
 *     @Override
 *     public ProductTable as(String newAlias) {
 *         return new ProductTable(newAlias);
 *     }
 * }
 * }</pre>
 */
public abstract class Table {

    private final String tableName;
    private final String alias;
    private final List<Column<?>> columns = new ArrayList<>();

    protected Table(String tableName, String alias) {
        this.tableName = tableName;
        this.alias = alias == null ? "" : alias;
    }

    /**
     * Creates a typed column bound to this table instance.
     * Must be called in the constructor so that aliased copies get fresh columns.
     */
    protected <T> Column<T> column(String name, Class<T> type) {
        Column<T> col = new Column<>(this, name, type);
        columns.add(col);
        return col;
    }

    /**
     * Creates a new instance of this table with a different alias.
     * All columns in the new instance will reference the new alias.
     */
    public abstract Table as(String newAlias);

    public String tableName() {
        return tableName;
    }

    public String alias() {
        return alias;
    }

    public boolean isAliased() {
        return !alias.isEmpty();
    }

    /**
     * Column prefix for this instance: {@code "alias."}, or empty when unaliased.
     */
    public String prefix() {
        return isAliased() ? alias + "." : "";
    }

    /**
     * Returns "tableName alias" for use in FROM / JOIN clauses.
     */
    public String declaration() {
        return isAliased() ? tableName + " " + alias : tableName;
    }

    public List<Column<?>> allColumns() {
        return Collections.unmodifiableList(columns);
    }

    @Override
    public String toString() {
        return declaration();
    }
}
