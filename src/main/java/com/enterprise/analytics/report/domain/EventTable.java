package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Table;

import java.time.LocalDateTime;

/**
 * An analytics-store table whose rows are visitor events. Exposes the columns
 * every report query needs regardless of the concrete table: the tracking
 * tuple, the visitor and session ids, the event timestamp and the engagement
 * flags the metrics aggregate over.
 */
public abstract class EventTable extends Table {

    protected EventTable(String tableName, String alias) {
        super(tableName, alias);
    }

    public abstract Column<String> urlPath();

    public abstract Column<String> source();

    public abstract Column<String> campaign();

    public abstract Column<String> adset();

    public abstract Column<String> ad();

    public abstract Column<String> visitorId();

    public abstract Column<String> sessionId();

    public abstract Column<LocalDateTime> occurredAt();

    public abstract EngagementColumns engagement();

    /** Row-level predicate: the visitor clicked a call-to-action element on this view. */
    public abstract String ctaClickedPredicate();

    /** Alias used whenever a second table joins this one. */
    public abstract String defaultAlias();

    @Override
    public abstract EventTable as(String newAlias);

    public EventTable unaliased() {
        return as("");
    }

    public EventTable aliased() {
        return as(defaultAlias());
    }
}
