package com.enterprise.analytics.report.dimension;

public enum ValueType {
    TEXT,
    NUMBER,
    /** Timestamp column truncated to a calendar day. */
    DATE,
    /** URL with its scheme stripped. */
    URL
}
