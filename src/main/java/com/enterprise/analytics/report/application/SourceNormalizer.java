package com.enterprise.analytics.report.application;

import com.enterprise.analytics.sql.core.SqlExpression;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collapses the spellings of one traffic source to a canonical token, so the
 * analytics store and the CRM agree on it. Unlisted sources are lower-cased.
 */
public final class SourceNormalizer {

    private SourceNormalizer() {}

    private static final Map<String, List<String>> VARIANTS = new LinkedHashMap<>();

    static {
        VARIANTS.put("google", List.of("google", "adwords"));
        VARIANTS.put("facebook", List.of("facebook", "meta", "fb"));
    }

    public static String normalize(String source) {
        if (source == null) {
            return "";
        }
        String lower = source.trim().toLowerCase(Locale.ROOT);
        return VARIANTS.entrySet().stream()
                .filter(e -> e.getValue().contains(lower))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(lower);
    }

    /** Every raw spelling that normalizes to the same token as {@code source}. */
    public static List<String> variants(String source) {
        String canonical = normalize(source);
        return VARIANTS.getOrDefault(canonical, List.of(canonical));
    }

    /**
     * SQL {@code CASE} applying {@link #normalize} in the database. Tokens are
     * fixed literals, so the fragment binds nothing.
     */
    public static String caseExpression(SqlExpression source) {
        String lower = "LOWER(" + source.ref() + ")";
        StringBuilder sql = new StringBuilder("CASE");
        VARIANTS.forEach((canonical, spellings) -> sql
                .append(" WHEN ").append(lower).append(" IN (")
                .append(spellings.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", ")))
                .append(") THEN '").append(canonical).append("'"));
        return sql.append(" ELSE COALESCE(").append(lower).append(", '') END").toString();
    }
}
