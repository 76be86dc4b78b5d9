package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.param.ParameterBinder;
import com.enterprise.analytics.sql.validation.ExpressionValidator;

import java.util.regex.Matcher;

/**
 * Escape hatch for SQL fragments not covered by typed conditions.
 * Uses {@code ?} placeholders bound via {@link ParameterBinder}, so the fragment
 * itself must not contain a literal question mark.
 * Validated by {@link ExpressionValidator} to block injection.
 */
public class RawCondition implements Condition {

    private final String sql;
    private final Object[] values;

    public RawCondition(String sql, Object[] values) {
        ExpressionValidator.validateExpression(sql.replace("?", "X"));
        long placeholders = sql.chars().filter(c -> c == '?').count();
        if (placeholders != values.length) {
            throw new IllegalArgumentException("Raw condition has " + placeholders
                    + " placeholders but " + values.length + " values: " + sql);
        }
        this.sql = sql;
        this.values = values.clone();
    }

    @Override
    public String toSql(ParameterBinder binder) {
        String result = sql;
        for (Object value : values) {
            String param = binder.bind(value, "raw");
            result = result.replaceFirst("\\?", Matcher.quoteReplacement(param));
        }
        return result;
    }
}
