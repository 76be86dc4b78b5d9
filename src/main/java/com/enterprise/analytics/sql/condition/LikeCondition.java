package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.core.SqlExpression;
import com.enterprise.analytics.sql.param.ParameterBinder;

import java.util.Objects;

/**
 * {@code expr [NOT] LIKE :pattern}. Pattern is parameterized, never inlined.
 */
public class LikeCondition implements Condition {

    private final SqlExpression expression;
    private final String pattern;
    private final boolean negated;

    public LikeCondition(SqlExpression expression, String pattern, boolean negated) {
        Objects.requireNonNull(expression);
        Objects.requireNonNull(pattern, "LIKE pattern must not be null");
        this.expression = expression;
        this.pattern = pattern;
        this.negated = negated;
    }

    @Override
    public String toSql(ParameterBinder binder) {
        String param = binder.bind(pattern, expression.hint());
        return expression.ref() + (negated ? " NOT LIKE " : " LIKE ") + param;
    }
}
