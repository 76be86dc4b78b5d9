package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.core.ComparisonOp;
import com.enterprise.analytics.sql.core.SqlExpression;
import com.enterprise.analytics.sql.param.ParameterBinder;

/**
 * {@code left op right} between two expressions. Mostly used in ON clauses.
 */
public class ColumnCondition implements Condition {

    private final SqlExpression left;
    private final ComparisonOp op;
    private final SqlExpression right;

    public ColumnCondition(SqlExpression left, ComparisonOp op, SqlExpression right) {
        this.left = left;
        this.op = op;
        this.right = right;
    }

    @Override
    public String toSql(ParameterBinder binder) {
        return left.ref() + " " + op.sql() + " " + right.ref();
    }
}
