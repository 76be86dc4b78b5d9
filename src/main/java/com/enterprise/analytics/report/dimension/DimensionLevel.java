package com.enterprise.analytics.report.dimension;

/**
 * Granularity a dimension is read at. ENTRY values describe a whole session (or a
 * page view in the page-view table); EVENT values exist only per page event and
 * force the session compiler into funnel mode.
 */
public enum DimensionLevel {
    ENTRY,
    EVENT
}
