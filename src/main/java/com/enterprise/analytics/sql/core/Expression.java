package com.enterprise.analytics.sql.core;

import com.enterprise.analytics.sql.validation.ExpressionValidator;

/**
 * Free-form SQL expression with a parameter hint. Validated on creation.
 */
public record Expression(String sql, String hint) implements SqlExpression {

    public Expression {
        ExpressionValidator.validateExpression(sql);
        ExpressionValidator.validateIdentifier(hint);
    }

    public static Expression of(String sql, String hint) {
        return new Expression(sql, hint);
    }

    @Override
    public String ref() {
        return sql;
    }

    @Override
    public String toString() {
        return sql;
    }
}
