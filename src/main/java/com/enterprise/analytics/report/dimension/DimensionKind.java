package com.enterprise.analytics.report.dimension;

public enum DimensionKind {
    /** A column (or a day/URL-normalized column) of the event table. */
    PLAIN,
    /** A raw tracking id whose display name comes from the spend-tracking source. */
    ENRICHED,
    /** A value taken from the curated URL classification table. */
    CLASSIFICATION
}
