package com.enterprise.analytics.sql.param;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Binds values to named parameters. {@link #bind(Object, String)} returns
 * {@code :hint_N} (counter starts at 1) and stores the value.
 *
 * <p>Hints are reduced to word characters so that the placeholder can always be
 * located again when converting to positional form. Values are stored as given:
 * booleans stay booleans, dates stay {@code LocalDate}.
 */
public class ParameterBinder {

    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private final AtomicInteger counter = new AtomicInteger(1);

    /**
     * Binds a value and returns the named placeholder (e.g. ":utm_campaign_1").
     */
    public String bind(Object value, String hint) {
        String name = sanitize(hint) + "_" + counter.getAndIncrement();
        parameters.put(name, value);
        return ":" + name;
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    private static String sanitize(String hint) {
        if (hint == null || hint.isBlank()) {
            return "p";
        }
        String cleaned = hint.replaceAll("\\W", "_");
        return Character.isLetter(cleaned.charAt(0)) ? cleaned : "p" + cleaned;
    }
}
