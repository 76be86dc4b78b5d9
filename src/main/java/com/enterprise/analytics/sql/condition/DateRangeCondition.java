package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.core.SqlExpression;
import com.enterprise.analytics.sql.param.ParameterBinder;
import com.enterprise.analytics.sql.param.SqlLiteralFormatter;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Half-open day range {@code expr >= DATE 'start' AND expr < DATE 'end + 1'}.
 *
 * <p>Both bounds are inlined as date literals. They come from typed
 * {@link LocalDate} values, so no user text reaches the SQL. The end date is
 * inclusive on input: every timestamp on that calendar day matches.
 */
public class DateRangeCondition implements Condition {

    private final SqlExpression expression;
    private final LocalDate start;
    private final LocalDate endInclusive;

    public DateRangeCondition(SqlExpression expression, LocalDate start, LocalDate endInclusive) {
        this.expression = Objects.requireNonNull(expression);
        this.start = Objects.requireNonNull(start, "start date must not be null");
        this.endInclusive = Objects.requireNonNull(endInclusive, "end date must not be null");
        if (endInclusive.isBefore(start)) {
            throw new IllegalArgumentException(
                    "Date range end " + endInclusive + " is before start " + start);
        }
    }

    @Override
    public String toSql(ParameterBinder binder) {
        return expression.ref() + " >= " + SqlLiteralFormatter.format(start)
                + " AND " + expression.ref() + " < " + SqlLiteralFormatter.format(endInclusive.plusDays(1));
    }
}
