package com.enterprise.analytics.report.domain;

import java.util.Map;

public record CrmVisitorRow(String visitorId, long trials, long approved) {

    public Conversions conversions() {
        return new Conversions(trials, approved);
    }

    public static CrmVisitorRow fromRow(Map<String, Object> row) {
        return new CrmVisitorRow(
                Rows.text(row, "ff_vid"),
                (long) Rows.number(row, "trials"),
                (long) Rows.number(row, "approved"));
    }
}
