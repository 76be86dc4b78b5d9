package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.core.SqlExpression;
import com.enterprise.analytics.sql.param.ParameterBinder;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code expr [NOT] IN (:p1, :p2, ...)}. Empty list rejected at construction.
 */
public class InListCondition implements Condition {

    private final SqlExpression expression;
    private final List<?> values;
    private final boolean negated;

    public InListCondition(SqlExpression expression, List<?> values, boolean negated) {
        Objects.requireNonNull(expression);
        Objects.requireNonNull(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN list must not be empty");
        }
        this.expression = expression;
        this.values = List.copyOf(values);
        this.negated = negated;
    }

    @Override
    public String toSql(ParameterBinder binder) {
        String params = values.stream()
                .map(v -> binder.bind(v, expression.hint()))
                .collect(Collectors.joining(", "));
        return expression.ref() + (negated ? " NOT IN (" : " IN (") + params + ")";
    }
}
