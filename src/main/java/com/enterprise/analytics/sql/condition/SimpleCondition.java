package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.core.ComparisonOp;
import com.enterprise.analytics.sql.core.SqlExpression;
import com.enterprise.analytics.sql.param.ParameterBinder;

import java.util.Objects;

public class SimpleCondition implements Condition {

    private final SqlExpression expression;
    private final ComparisonOp op;
    private final Object value;

    public SimpleCondition(SqlExpression expression, ComparisonOp op, Object value) {
        Objects.requireNonNull(expression, "Expression must not be null");
        if (value == null) {
            throw new NullPointerException(
                "Value for " + expression.hint() + " is null. Use the IfPresent variant or isNull()");
        }
        this.expression = expression;
        this.op = op;
        this.value = value;
    }

    @Override
    public String toSql(ParameterBinder binder) {
        String param = binder.bind(value, expression.hint());
        return expression.ref() + " " + op.sql() + " " + param;
    }
}
