package com.enterprise.analytics.report.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive calendar-day range of a report request.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new ReportQueryException("Date range end " + end + " is before start " + start);
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }
}
