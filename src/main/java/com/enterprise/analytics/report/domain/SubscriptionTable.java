package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Table;

import java.time.LocalDateTime;

/**
 * CRM subscriptions. The tracking ids mirror the analytics-side tuple:
 * {@code tracking_id_4} is the campaign, {@code tracking_id_2} the ad set and
 * {@code tracking_id} the ad.
 */
public final class SubscriptionTable extends Table {

    public static final SubscriptionTable SUBSCRIPTIONS = new SubscriptionTable("s");

    public final Column<Long>          ID;
    public final Column<LocalDateTime> DATE_CREATE;
    public final Column<Integer>       DELETED;
    public final Column<Long>          SOURCE_ID;
    public final Column<String>        TRACKING_ID;
    public final Column<String>        TRACKING_ID_2;
    public final Column<String>        TRACKING_ID_4;
    public final Column<String>        VISITOR_ID;

    public SubscriptionTable(String alias) {
        super("subscription", alias);
        this.ID            = column("id", Long.class);
        this.DATE_CREATE   = column("date_create", LocalDateTime.class);
        this.DELETED       = column("deleted", Integer.class);
        this.SOURCE_ID     = column("source_id", Long.class);
        this.TRACKING_ID   = column("tracking_id", String.class);
        this.TRACKING_ID_2 = column("tracking_id_2", String.class);
        this.TRACKING_ID_4 = column("tracking_id_4", String.class);
        this.VISITOR_ID    = column("ff_vid", String.class);
    }

    @Override
    public SubscriptionTable as(String newAlias) {
        return new SubscriptionTable(newAlias);
    }
}
