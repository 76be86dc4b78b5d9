package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.core.ComparisonOp;
import com.enterprise.analytics.sql.core.SqlExpression;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Static factory for creating {@link Condition} instances.
 * Designed to be imported statically for a clean DSL.
 *
 * <pre>{@code
 * import static com.enterprise.analytics.sql.condition.Conditions.*;
 *
 * Condition c1 = eq(PAGE_VIEWS.UTM_SOURCE.lower(), "google");
 * Condition c2 = isNull(PAGE_VIEWS.COUNTRY_CODE);
 *
 * // Optional conditions (return null if value is null, safe for where(...) varargs)
 * Condition c3 = eqIfPresent(PAGE_VIEWS.DEVICE_TYPE, params.get("device")); // may be null
 *
 * Condition c4 = or(
 *     eq(PAGE_VIEWS.UTM_SOURCE.lower(), "google"),
 *     and(
 *         like(PAGE_VIEWS.URL_PATH.lower(), "%/pricing%"),
 *         isNotNull(PAGE_VIEWS.UTM_CAMPAIGN)
 *     )
 * );
 * }</pre>
 */
public final class Conditions {

    private Conditions() {}

    // ==================== Strict conditions (null → exception) ====================

    public static Condition eq(SqlExpression expression, Object value) {
        return new SimpleCondition(expression, ComparisonOp.EQ, value);
    }

    public static Condition neq(SqlExpression expression, Object value) {
        return new SimpleCondition(expression, ComparisonOp.NEQ, value);
    }

    public static Condition like(SqlExpression expression, String pattern) {
        return new LikeCondition(expression, pattern, false);
    }

    public static Condition notLike(SqlExpression expression, String pattern) {
        return new LikeCondition(expression, pattern, true);
    }

    public static Condition contains(SqlExpression expression, String value) {
        Objects.requireNonNull(value);
        return new LikeCondition(expression, "%" + value + "%", false);
    }

    public static Condition notContains(SqlExpression expression, String value) {
        Objects.requireNonNull(value);
        return new LikeCondition(expression, "%" + value + "%", true);
    }

    public static Condition in(SqlExpression expression, List<?> values) {
        return new InListCondition(expression, values, false);
    }

    public static Condition notIn(SqlExpression expression, List<?> values) {
        return new InListCondition(expression, values, true);
    }

    public static Condition isNull(SqlExpression expression) {
        return new NullCondition(expression, false);
    }

    public static Condition isNotNull(SqlExpression expression) {
        return new NullCondition(expression, true);
    }

    public static Condition isTrue(SqlExpression expression) {
        return new BooleanCondition(expression, true);
    }

    public static Condition isFalse(SqlExpression expression) {
        return new BooleanCondition(expression, false);
    }

    /** Inclusive day range, rendered half-open with inlined date literals. */
    public static Condition withinDays(SqlExpression expression, LocalDate start, LocalDate endInclusive) {
        return new DateRangeCondition(expression, start, endInclusive);
    }

    // ==================== Optional conditions (null → return null) ====================

    /**
     * Returns null if value is null. Designed for use with {@code where(Condition...)}
     * which filters out nulls.
     */
    public static Condition eqIfPresent(SqlExpression expression, Object value) {
        return value == null ? null : eq(expression, value);
    }

    public static Condition inIfPresent(SqlExpression expression, List<?> values) {
        return (values == null || values.isEmpty()) ? null : in(expression, values);
    }

    // ==================== Column comparisons ====================

    public static Condition eqColumn(SqlExpression left, SqlExpression right) {
        return new ColumnCondition(left, ComparisonOp.EQ, right);
    }

    // ==================== Subquery conditions ====================

    public static Condition inSubquery(SqlExpression expression, CompiledQuery subquery) {
        return SubqueryCondition.in(expression, subquery);
    }

    public static Condition notInSubquery(SqlExpression expression, CompiledQuery subquery) {
        return SubqueryCondition.notIn(expression, subquery);
    }

    // ==================== Composite conditions (AND/OR) ====================

    /**
     * Combines conditions with AND. Null conditions filtered out.
     * Throws if none remain after filtering.
     */
    public static Condition and(Condition... conditions) {
        return and(Arrays.asList(conditions));
    }

    public static Condition and(List<Condition> conditions) {
        List<Condition> nonNull = filterNulls(conditions);
        if (nonNull.isEmpty()) {
            throw new IllegalArgumentException("and() requires at least one non-null condition");
        }
        return nonNull.size() == 1 ? nonNull.get(0)
                : new CompositeCondition(CompositeCondition.Logic.AND, nonNull);
    }

    /**
     * Combines conditions with OR. Null conditions filtered out.
     * Throws if none remain after filtering.
     */
    public static Condition or(Condition... conditions) {
        return or(Arrays.asList(conditions));
    }

    public static Condition or(List<Condition> conditions) {
        List<Condition> nonNull = filterNulls(conditions);
        if (nonNull.isEmpty()) {
            throw new IllegalArgumentException("or() requires at least one non-null condition");
        }
        return nonNull.size() == 1 ? nonNull.get(0)
                : new CompositeCondition(CompositeCondition.Logic.OR, nonNull);
    }

    /**
     * Combines with AND, filtering out nulls. Returns null if no conditions remain.
     */
    public static Condition andIfAny(List<Condition> conditions) {
        List<Condition> nonNull = filterNulls(conditions);
        if (nonNull.isEmpty()) return null;
        return nonNull.size() == 1 ? nonNull.get(0)
                : new CompositeCondition(CompositeCondition.Logic.AND, nonNull);
    }

    /**
     * Combines with OR, filtering out nulls. Returns null if no conditions remain.
     */
    public static Condition orIfAny(List<Condition> conditions) {
        List<Condition> nonNull = filterNulls(conditions);
        if (nonNull.isEmpty()) return null;
        return nonNull.size() == 1 ? nonNull.get(0)
                : new CompositeCondition(CompositeCondition.Logic.OR, nonNull);
    }

    // ==================== Raw condition ====================

    /**
     * Raw SQL fragment for edge cases. Validated for injection safety.
     * Use "?" for parameter placeholders.
     */
    public static Condition raw(String sql, Object... values) {
        return new RawCondition(sql, values);
    }

    // ==================== Helpers ====================

    private static List<Condition> filterNulls(List<Condition> conditions) {
        return conditions.stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
