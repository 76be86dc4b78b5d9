package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Table;

import java.time.LocalDate;

/**
 * Spend-tracking source: one row per network, day and ad, carrying the display
 * names of the campaign, ad set and ad. Read-only from the report layer.
 */
public final class AdSpendTable extends Table {

    public static final AdSpendTable AD_SPEND = new AdSpendTable("mas");

    public final Column<LocalDate> DATE;
    public final Column<String>    NETWORK;
    public final Column<String>    CAMPAIGN_ID;
    public final Column<String>    CAMPAIGN_NAME;
    public final Column<String>    ADSET_ID;
    public final Column<String>    ADSET_NAME;
    public final Column<String>    AD_ID;
    public final Column<String>    AD_NAME;

    public AdSpendTable(String alias) {
        super("merged_ads_spending", alias);
        this.DATE          = column("date", LocalDate.class);
        this.NETWORK       = column("network", String.class);
        this.CAMPAIGN_ID   = column("campaign_id", String.class);
        this.CAMPAIGN_NAME = column("campaign_name", String.class);
        this.ADSET_ID      = column("adset_id", String.class);
        this.ADSET_NAME    = column("adset_name", String.class);
        this.AD_ID         = column("ad_id", String.class);
        this.AD_NAME       = column("ad_name", String.class);
    }

    @Override
    public AdSpendTable as(String newAlias) {
        return new AdSpendTable(newAlias);
    }
}
