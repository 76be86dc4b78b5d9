package com.enterprise.analytics.report.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One drill-down row: the dimension key, its metrics as returned by the
 * analytics store, and the CRM conversions attributed through tracking ids and
 * through visitor ids.
 */
public record ReportRow(
    String dimensionId,
    String dimensionValue,
    Map<String, Object> metrics,
    Conversions trackingConversions,
    Conversions visitorConversions
) {

    public ReportRow {
        // metric values may be null (e.g. a rate over zero rows)
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }
}
