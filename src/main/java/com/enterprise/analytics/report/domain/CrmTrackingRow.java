package com.enterprise.analytics.report.domain;

import java.util.Map;

/** CRM subscriptions per normalized source and tracking tuple. */
public record CrmTrackingRow(
    String source,
    String campaignId,
    String adsetId,
    String adId,
    long trials,
    long approved
) {

    public Conversions conversions() {
        return new Conversions(trials, approved);
    }

    public static CrmTrackingRow fromRow(Map<String, Object> row) {
        return new CrmTrackingRow(
                Rows.textOrEmpty(row, "source"),
                Rows.textOrEmpty(row, "campaign_id"),
                Rows.textOrEmpty(row, "adset_id"),
                Rows.textOrEmpty(row, "ad_id"),
                (long) Rows.number(row, "trials"),
                (long) Rows.number(row, "approved"));
    }
}
