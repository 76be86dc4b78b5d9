package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.core.SqlExpression;
import com.enterprise.analytics.sql.param.ParameterBinder;

/**
 * {@code expr = true} / {@code expr = false} with the constant inlined.
 * Used in join conditions where a bound flag would add nothing.
 */
public class BooleanCondition implements Condition {

    private final SqlExpression expression;
    private final boolean expected;

    public BooleanCondition(SqlExpression expression, boolean expected) {
        this.expression = expression;
        this.expected = expected;
    }

    @Override
    public String toSql(ParameterBinder binder) {
        return expression.ref() + " = " + expected;
    }
}
