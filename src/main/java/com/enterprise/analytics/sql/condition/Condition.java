package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.param.ParameterBinder;

@FunctionalInterface
public interface Condition {
    String toSql(ParameterBinder binder);
}
