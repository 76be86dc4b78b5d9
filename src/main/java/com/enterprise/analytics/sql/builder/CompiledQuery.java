package com.enterprise.analytics.sql.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Final query text with its named parameters. Executors consume the
 * {@link #toPositional() positional} form.
 */
public class CompiledQuery {

    // ":name" not preceded by another colon (PostgreSQL casts) or a word character
    private static final Pattern PLACEHOLDER = Pattern.compile("(?<![:\\w]):([A-Za-z_]\\w*)");

    private final String sql;
    private final Map<String, Object> parameters;

    public CompiledQuery(String sql, Map<String, Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String sql() { return sql; }

    public Map<String, Object> namedParameters() { return parameters; }

    /**
     * Converts named parameters to positional ({@code ?}) in the order they appear
     * in the text. A placeholder that occurs twice contributes its value twice.
     */
    public PositionalQuery toPositional() {
        Matcher m = PLACEHOLDER.matcher(sql);
        StringBuilder positionalSql = new StringBuilder();
        List<Object> values = new ArrayList<>();
        while (m.find()) {
            String name = m.group(1);
            if (!parameters.containsKey(name)) {
                throw new IllegalStateException(
                        "SQL references :" + name + " but no parameter was bound");
            }
            values.add(parameters.get(name));
            m.appendReplacement(positionalSql, "?");
        }
        m.appendTail(positionalSql);
        return new PositionalQuery(positionalSql.toString(), Collections.unmodifiableList(values));
    }

    /** Positional parameter values in text order. */
    public List<Object> parameters() {
        return toPositional().values();
    }

    /** Returns the SQL with all parameter values inlined for debugging. */
    public String toDebugString() {
        Matcher m = PLACEHOLDER.matcher(sql);
        StringBuilder inlined = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            String replacement = parameters.containsKey(name)
                    ? render(parameters.get(name))
                    : m.group();
            m.appendReplacement(inlined, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(inlined);
        return inlined.toString();
    }

    /** Verifies every :param in the SQL has a matching entry in the map. */
    public void verify() {
        Matcher m = PLACEHOLDER.matcher(sql);
        while (m.find()) {
            String name = m.group(1);
            if (!parameters.containsKey(name)) {
                throw new IllegalStateException(
                        "SQL references :" + name + " but no parameter was bound");
            }
        }
    }

    private static String render(Object value) {
        if (value instanceof CharSequence || value instanceof java.time.temporal.Temporal) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompiledQuery other)) return false;
        return sql.equals(other.sql) && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return sql.hashCode() * 31 + parameters.hashCode();
    }

    @Override
    public String toString() {
        return sql;
    }

    public record PositionalQuery(String sql, List<Object> values) {

        public Object[] valuesArray() {
            return values.toArray();
        }
    }
}
