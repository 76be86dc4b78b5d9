package com.enterprise.analytics.sql.builder;

import com.enterprise.analytics.sql.condition.Condition;
import com.enterprise.analytics.sql.core.*;
import com.enterprise.analytics.sql.param.ParameterBinder;
import com.enterprise.analytics.sql.validation.ExpressionValidator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The main entry point for building report SQL.
 * Produces a {@link CompiledQuery} with named parameters.
 *
 * <p>Each clause is collected as an immutable fragment (strings for SELECT, JOIN,
 * GROUP BY and ORDER BY entries, {@link Condition} objects for WHERE) and the whole
 * statement is rendered once in {@link #build()}. Conditions are rendered in clause
 * order, so parameter numbering follows the text.
 *
 * <p>Example:
 * <pre>{@code
 * import static com.enterprise.analytics.sql.condition.Conditions.*;
 *
 * CompiledQuery query = SelectBuilder.query()
 *     .select(PAGE_VIEWS.COUNTRY_CODE.refAs("dimension_value"), "COUNT(*) AS page_views")
 *     .from(PAGE_VIEWS)
 *     .where(
 *         withinDays(PAGE_VIEWS.CREATED_AT, range.start(), range.end()),
 *         eqIfPresent(PAGE_VIEWS.DEVICE_TYPE, params.get("device"))
 *     )
 *     .groupBy(PAGE_VIEWS.COUNTRY_CODE)
 *     .orderByExpr("page_views", SortDirection.DESC, NullsOrder.NULLS_LAST)
 *     .limit(1000)
 *     .build();
 * }</pre>
 *
 * @see Condition
 */
public class SelectBuilder {

    private final ParameterBinder binder;
    private SqlDialect dialect;

    private final List<CteClause> ctes = new ArrayList<>();

    // SELECT
    private String selectClause;
    private boolean distinct;

    // FROM
    private String fromClause;

    private final List<String> joins = new ArrayList<>();

    private final List<Condition> conditions = new ArrayList<>();

    // GROUP BY / HAVING
    private final List<String> groupByColumns = new ArrayList<>();
    private final List<Condition> havingConditions = new ArrayList<>();

    // ORDER BY
    private final List<String> orderByClauses = new ArrayList<>();

    // LIMIT / OFFSET
    private Integer limitValue;
    private Integer offsetValue;

    private SelectBuilder(ParameterBinder binder) {
        this.binder = binder;
        this.dialect = Dialects.POSTGRES;
    }

    // ==================== Factory ====================

    /**
     * Creates a new SelectBuilder with a fresh ParameterBinder.
     */
    public static SelectBuilder query() {
        return new SelectBuilder(new ParameterBinder());
    }

    /**
     * Creates a new SelectBuilder sharing a ParameterBinder with the parent.
     * Used for subqueries and CTEs that need globally unique parameter names.
     */
    public static SelectBuilder subquery(ParameterBinder sharedBinder) {
        return new SelectBuilder(sharedBinder);
    }

    public ParameterBinder binder() {
        return binder;
    }

    // ==================== Dialect ====================

    public SelectBuilder dialect(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect);
        return this;
    }

    // ==================== CTE (WITH clause) ====================

    /**
     * Adds a Common Table Expression (WITH clause).
     * The CTE query MUST share this builder's binder via {@link #subquery(ParameterBinder)},
     * otherwise parameter names will collide.
     */
    public SelectBuilder with(String cteName, CompiledQuery cteQuery) {
        ExpressionValidator.validateIdentifier(cteName);
        ctes.add(new CteClause(cteName, cteQuery.sql()));
        return this;
    }

    // ==================== SELECT ====================

    public SelectBuilder select(String... columns) {
        return select(Arrays.asList(columns));
    }

    public SelectBuilder select(List<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("SELECT list must not be empty");
        }
        this.selectClause = String.join(", ", columns);
        return this;
    }

    public SelectBuilder selectDistinct(String... columns) {
        this.distinct = true;
        return select(columns);
    }

    // ==================== FROM ====================

    public SelectBuilder from(Table table) {
        this.fromClause = table.declaration();
        return this;
    }

    // ==================== JOIN ====================

    /**
     * Type-safe join on two columns.
     */
    public SelectBuilder join(JoinType type, Table table,
                              Column<?> leftCol, Column<?> rightCol) {
        joins.add(type.sql() + " " + table.declaration()
                + " ON " + leftCol.eqColumn(rightCol));
        return this;
    }

    /**
     * Join with a multi-condition ON clause.
     */
    public SelectBuilder join(JoinType type, Table table, Condition... onConditions) {
        String onClause = Arrays.stream(onConditions)
                .filter(Objects::nonNull)
                .map(c -> c.toSql(binder))
                .collect(Collectors.joining(" AND "));
        joins.add(type.sql() + " " + table.declaration() + " ON " + onClause);
        return this;
    }

    /**
     * Join on a derived table (subquery).
     * The subquery must have been built with the SAME ParameterBinder.
     */
    public SelectBuilder joinSubquery(JoinType type, CompiledQuery subquery,
                                      String alias, String onClause) {
        ExpressionValidator.validateIdentifier(alias);
        ExpressionValidator.validateExpression(onClause);
        joins.add(type.sql() + " (" + subquery.sql() + ") " + alias
                + " ON " + onClause);
        return this;
    }

    /**
     * Join on a named source such as a CTE reference.
     */
    public SelectBuilder joinRaw(JoinType type, String tableOrCte,
                                 String onClause) {
        ExpressionValidator.validateExpression(tableOrCte);
        ExpressionValidator.validateExpression(onClause);
        joins.add(type.sql() + " " + tableOrCte + " ON " + onClause);
        return this;
    }

    public SelectBuilder leftJoin(Table t, Column<?> l, Column<?> r) {
        return join(JoinType.LEFT, t, l, r);
    }

    // ==================== WHERE ====================

    /**
     * Adds WHERE conditions. Null conditions are silently filtered out,
     * enabling the "IfPresent" pattern from {@link com.enterprise.analytics.sql.condition.Conditions}.
     * All non-null conditions are combined with AND.
     */
    public SelectBuilder where(Condition... conditions) {
        return where(Arrays.asList(conditions));
    }

    public SelectBuilder where(List<Condition> conditions) {
        for (Condition c : conditions) {
            if (c != null) {
                this.conditions.add(c);
            }
        }
        return this;
    }

    // ==================== GROUP BY / HAVING ====================

    public SelectBuilder groupBy(Column<?>... columns) {
        for (Column<?> col : columns) {
            groupByColumns.add(col.ref());
        }
        return this;
    }

    public SelectBuilder groupByExpr(String... expressions) {
        return groupByExpr(Arrays.asList(expressions));
    }

    public SelectBuilder groupByExpr(List<String> expressions) {
        for (String expr : expressions) {
            ExpressionValidator.validateExpression(expr);
            groupByColumns.add(expr);
        }
        return this;
    }

    /**
     * HAVING with a constant aggregate predicate such as {@code COUNT(*) > 1}.
     */
    public SelectBuilder havingExpr(String expression) {
        ExpressionValidator.validateExpression(expression);
        havingConditions.add(b -> expression);
        return this;
    }

    // ==================== ORDER BY ====================

    public SelectBuilder orderBy(Column<?> column, SortDirection dir) {
        orderByClauses.add(column.ref() + " " + dir.name());
        return this;
    }

    public SelectBuilder orderByExpr(String expression, SortDirection dir) {
        ExpressionValidator.validateExpression(expression);
        orderByClauses.add(expression + " " + dir.name());
        return this;
    }

    public SelectBuilder orderByExpr(String expression, SortDirection dir, NullsOrder nulls) {
        ExpressionValidator.validateExpression(expression);
        orderByClauses.add(expression + " " + dir.name() + " " + nulls.sql());
        return this;
    }

    // ==================== LIMIT / OFFSET ====================

    public SelectBuilder limit(int count) {
        this.limitValue = count;
        return this;
    }

    public SelectBuilder offset(int skip) {
        this.offsetValue = skip;
        return this;
    }

    // ==================== BUILD ====================

    /**
     * Builds the final SQL query with named parameters and verifies that every
     * placeholder has a bound value.
     */
    public CompiledQuery build() {
        if (selectClause == null) {
            throw new IllegalStateException("select(...) must be called before build()");
        }
        StringBuilder sql = new StringBuilder();

        if (!ctes.isEmpty()) {
            sql.append("WITH ");
            sql.append(ctes.stream()
                    .map(cte -> cte.name + " AS (" + cte.sql + ")")
                    .collect(Collectors.joining(", ")));
            sql.append(" ");
        }

        sql.append("SELECT ");
        if (distinct) sql.append("DISTINCT ");
        sql.append(selectClause);

        if (fromClause != null) {
            sql.append(" FROM ").append(fromClause);
        }

        for (String join : joins) {
            sql.append(" ").append(join);
        }

        if (!conditions.isEmpty()) {
            String whereClause = conditions.stream()
                    .map(c -> c.toSql(binder))
                    .collect(Collectors.joining(" AND "));
            sql.append(" WHERE ").append(whereClause);
        }

        if (!groupByColumns.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupByColumns));
        }

        if (!havingConditions.isEmpty()) {
            String havingClause = havingConditions.stream()
                    .map(c -> c.toSql(binder))
                    .collect(Collectors.joining(" AND "));
            sql.append(" HAVING ").append(havingClause);
        }

        if (!orderByClauses.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderByClauses));
        }

        if (limitValue != null && offsetValue != null) {
            sql.append(" ").append(dialect.limitOffset(limitValue, offsetValue));
        } else if (limitValue != null) {
            sql.append(" ").append(dialect.limit(limitValue));
        } else if (offsetValue != null) {
            sql.append(" ").append(dialect.offset(offsetValue));
        }

        CompiledQuery result = new CompiledQuery(sql.toString(), binder.getParameters());
        result.verify();
        return result;
    }

    private record CteClause(String name, String sql) {}
}
