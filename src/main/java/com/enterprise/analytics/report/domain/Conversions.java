package com.enterprise.analytics.report.domain;

/**
 * CRM conversions attributed to one dimension value. Fractional because
 * attribution distributes a subscription across the values it spans.
 */
public record Conversions(double trials, double approved) {

    public static final Conversions NONE = new Conversions(0, 0);

    public Conversions plus(Conversions other) {
        return new Conversions(trials + other.trials, approved + other.approved);
    }

    public Conversions scaled(double factor) {
        return new Conversions(trials * factor, approved * factor);
    }
}
