package com.enterprise.analytics.report.dimension;

import com.enterprise.analytics.report.domain.QueryRequest;
import com.enterprise.analytics.report.domain.ReportQueryException;
import com.enterprise.analytics.sql.condition.Condition;
import com.enterprise.analytics.sql.core.Expression;
import com.enterprise.analytics.sql.core.SqlExpression;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

import static com.enterprise.analytics.report.domain.AdSpendTable.AD_SPEND;
import static com.enterprise.analytics.sql.condition.Conditions.eq;
import static com.enterprise.analytics.sql.condition.Conditions.isNull;

/**
 * Renders a {@link DimensionDescriptor} into SQL fragments. Every compiler goes
 * through these methods, so a dimension reads the same in SELECT, GROUP BY,
 * ancestor filters and user filters.
 */
public final class DimensionRenderer {

    private DimensionRenderer() {}

    private static final String SCHEME_PATTERN = "'^[a-z]+://'";

    /**
     * The per-row value of the dimension: the shaped column for plain
     * dimensions, the raw id for enriched ones, the grouping key for
     * classification ones.
     */
    public static SqlExpression valueExpression(DimensionDescriptor d, ColumnScope scope) {
        if (d instanceof PlainDimension p) {
            SqlExpression col = scope.qualify(p.column(), p.level());
            return switch (p.valueType()) {
                case TEXT, NUMBER -> col;
                case DATE -> Expression.of("CAST(" + col.ref() + " AS DATE)", col.hint());
                case URL -> Expression.of("REGEXP_REPLACE(" + col.ref() + ", " + SCHEME_PATTERN + ", '')", col.hint());
            };
        }
        if (d instanceof EnrichedDimension e) {
            return scope.qualify(e.rawColumn());
        }
        ClassificationDimension c = (ClassificationDimension) d;
        return Expression.of(c.groupByExpression(), c.id());
    }

    /** Whether SELECT emits an id column next to the value column. */
    public static boolean hasIdColumn(DimensionDescriptor d) {
        return d instanceof EnrichedDimension
                || (d instanceof ClassificationDimension c && c.hasIdColumn());
    }

    /**
     * SELECT entries for the dimension. Enriched dimensions yield the raw id and
     * the resolved display name, which falls back to the raw id and then to
     * {@code 'Unknown'} so it is never NULL or empty.
     */
    public static List<String> selectColumns(DimensionDescriptor d, ColumnScope scope,
                                             String idAlias, String valueAlias) {
        if (d instanceof EnrichedDimension e) {
            SqlExpression rawText = scope.qualify(e.rawColumn()).castText();
            String name = "MAX(" + e.specificity().spendName(AD_SPEND).ref() + ")";
            return List.of(
                    rawText.ref() + " AS " + idAlias,
                    "COALESCE(NULLIF(" + name + ", ''), NULLIF(" + rawText.ref() + ", ''), '"
                            + QueryRequest.UNKNOWN + "') AS " + valueAlias);
        }
        if (d instanceof ClassificationDimension c) {
            return c.hasIdColumn()
                    ? List.of(c.selectIdExpression() + " AS " + idAlias,
                              c.selectNameExpression() + " AS " + valueAlias)
                    : List.of(c.selectNameExpression() + " AS " + valueAlias);
        }
        return List.of(valueExpression(d, scope).ref() + " AS " + valueAlias);
    }

    public static String groupByExpression(DimensionDescriptor d, ColumnScope scope) {
        return valueExpression(d, scope).ref();
    }

    /**
     * Ancestor filter: equality against the key a shallower level returned, or
     * IS NULL when the value is {@value QueryRequest#UNKNOWN}.
     */
    public static Condition parentFilter(DimensionDescriptor d, ColumnScope scope, String value) {
        SqlExpression target = parentFilterTarget(d, scope);
        if (value == null || QueryRequest.UNKNOWN.equals(value)) {
            return isNull(target);
        }
        if (d instanceof PlainDimension p && p.valueType() == ValueType.DATE) {
            return eq(target, parseDay(d.id(), value));
        }
        if (d instanceof PlainDimension p && p.valueType() == ValueType.NUMBER) {
            return eq(target.castText(), value);
        }
        if (d instanceof EnrichedDimension) {
            return eq(target.castText(), value);
        }
        return eq(target, value);
    }

    private static SqlExpression parentFilterTarget(DimensionDescriptor d, ColumnScope scope) {
        if (d instanceof ClassificationDimension c) {
            return Expression.of(c.parentFilterExpression(), c.id());
        }
        return valueExpression(d, scope);
    }

    /** Lower-cased text form compared against user-typed filter values. */
    public static SqlExpression filterTarget(DimensionDescriptor d, ColumnScope scope) {
        if (d instanceof ClassificationDimension c) {
            return Expression.of(c.tableFilterExpression(), c.id());
        }
        if (d instanceof PlainDimension p && (p.valueType() == ValueType.TEXT || p.valueType() == ValueType.URL)) {
            return valueExpression(d, scope).lower();
        }
        return valueExpression(d, scope).castText().lower();
    }

    /** Expression tested by IS [NOT] NULL filters. */
    public static SqlExpression nullTarget(DimensionDescriptor d, ColumnScope scope) {
        return parentFilterTarget(d, scope);
    }

    private static LocalDate parseDay(String dimensionId, String value) {
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            throw new ReportQueryException("Invalid date value for " + dimensionId + ": " + value, e);
        }
    }
}
