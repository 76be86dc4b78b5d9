package com.enterprise.analytics.report.domain;

import java.util.Map;

public record VisitorMatchRow(String dimensionValue, String visitorId) {

    public static VisitorMatchRow fromRow(Map<String, Object> row) {
        return new VisitorMatchRow(
                Rows.text(row, "dimension_value"),
                Rows.text(row, "ff_visitor_id"));
    }
}
