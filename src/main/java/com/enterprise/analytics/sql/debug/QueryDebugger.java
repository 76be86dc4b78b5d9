package com.enterprise.analytics.sql.debug;

import com.enterprise.analytics.sql.builder.CompiledQuery;

import java.util.Map;

/**
 * Debug utility: formats a {@link CompiledQuery} showing named-param SQL,
 * positional SQL, values-inlined SQL, and parameter list with types.
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    public static String format(CompiledQuery query) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== SQL Query Debug ===\n");

        sb.append("SQL (named):\n  ").append(query.sql()).append("\n");

        CompiledQuery.PositionalQuery pq = query.toPositional();
        sb.append("SQL (positional):\n  ").append(pq.sql()).append("\n");

        sb.append("SQL (values inlined):\n  ").append(query.toDebugString()).append("\n");

        Map<String, Object> params = query.namedParameters();
        sb.append("Parameters (").append(params.size()).append("):\n");
        for (Map.Entry<String, Object> e : params.entrySet()) {
            Object val = e.getValue();
            String typeName = val != null ? val.getClass().getSimpleName() : "null";
            sb.append("  ").append(e.getKey()).append(" = ").append(val)
                    .append(" (").append(typeName).append(")\n");
        }
        sb.append("======================");
        return sb.toString();
    }
}
