package com.enterprise.analytics.report.dimension;

import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Expression;
import com.enterprise.analytics.sql.core.SqlExpression;

/**
 * Decides how bare column names are qualified in one query. Every fragment of a
 * query qualifies its columns through the same scope, so SELECT, WHERE and
 * GROUP BY agree on prefixes whether or not a join is present.
 *
 * <p>Entry-level and event-level columns can live behind different aliases: in
 * funnel mode entry columns come from the {@code matching_sessions} CTE
 * ({@code ms.}) while event columns come from the page-view table ({@code pv.}).
 */
public record ColumnScope(String entryPrefix, String eventPrefix) {

    public static final ColumnScope UNQUALIFIED = new ColumnScope("", "");

    public static ColumnScope single(String prefix) {
        return new ColumnScope(prefix, prefix);
    }

    public static ColumnScope funnel(String entryAlias, String eventAlias) {
        return new ColumnScope(entryAlias + ".", eventAlias + ".");
    }

    public SqlExpression qualify(Column<?> column) {
        return qualify(column, DimensionLevel.ENTRY);
    }

    public SqlExpression qualify(Column<?> column, DimensionLevel level) {
        String prefix = level == DimensionLevel.EVENT ? eventPrefix : entryPrefix;
        return Expression.of(prefix + column.name(), column.name());
    }
}
