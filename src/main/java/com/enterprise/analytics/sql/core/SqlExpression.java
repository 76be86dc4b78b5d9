package com.enterprise.analytics.sql.core;

/**
 * Anything that renders to a SQL value expression: a table {@link Column} or a
 * derived expression such as {@code CAST(pv.utm_campaign AS TEXT)}.
 *
 * <p>{@link #hint()} names bind parameters compared against this expression,
 * so it must be a plain word ({@code [A-Za-z_]\w*}).
 */
public interface SqlExpression {

    /** Rendered SQL for this expression. */
    String ref();

    /** Descriptive stem for parameters bound against this expression. */
    String hint();

    default SqlExpression lower() {
        return Expression.of("LOWER(" + ref() + ")", hint());
    }

    default SqlExpression castText() {
        return Expression.of("CAST(" + ref() + " AS TEXT)", hint());
    }
}
