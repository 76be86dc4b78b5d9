package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.core.SqlExpression;
import com.enterprise.analytics.sql.param.ParameterBinder;

/**
 * {@code expr [NOT] IN (subquery)}. The subquery must have been built on the
 * same {@link ParameterBinder} as the enclosing query.
 */
public class SubqueryCondition implements Condition {

    private final SqlExpression expression;
    private final String operator;
    private final CompiledQuery subquery;

    private SubqueryCondition(SqlExpression expression, String operator, CompiledQuery subquery) {
        this.expression = expression;
        this.operator = operator;
        this.subquery = subquery;
    }

    public static SubqueryCondition in(SqlExpression expression, CompiledQuery subquery) {
        return new SubqueryCondition(expression, "IN", subquery);
    }

    public static SubqueryCondition notIn(SqlExpression expression, CompiledQuery subquery) {
        return new SubqueryCondition(expression, "NOT IN", subquery);
    }

    @Override
    public String toSql(ParameterBinder binder) {
        return expression.ref() + " " + operator + " (" + subquery.sql() + ")";
    }
}
