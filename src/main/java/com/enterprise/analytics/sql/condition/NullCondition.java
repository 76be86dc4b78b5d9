package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.core.SqlExpression;
import com.enterprise.analytics.sql.param.ParameterBinder;

/**
 * {@code expr IS [NOT] NULL}. No parameter binding needed.
 */
public class NullCondition implements Condition {

    private final SqlExpression expression;
    private final boolean negated;

    public NullCondition(SqlExpression expression, boolean negated) {
        this.expression = expression;
        this.negated = negated;
    }

    @Override
    public String toSql(ParameterBinder binder) {
        return expression.ref() + (negated ? " IS NOT NULL" : " IS NULL");
    }
}
