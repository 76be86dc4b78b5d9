package com.enterprise.analytics.report.domain;

import java.util.Map;

/** Analytics-side visitor count per dimension value and tracking tuple. */
public record TrackingMatchRow(
    String dimensionValue,
    String source,
    String campaignId,
    String adsetId,
    String adId,
    long uniqueVisitors
) {

    public static TrackingMatchRow fromRow(Map<String, Object> row) {
        return new TrackingMatchRow(
                Rows.text(row, "dimension_value"),
                Rows.textOrEmpty(row, "source"),
                Rows.textOrEmpty(row, "campaign_id"),
                Rows.textOrEmpty(row, "adset_id"),
                Rows.textOrEmpty(row, "ad_id"),
                (long) Rows.number(row, "unique_visitors"));
    }
}
