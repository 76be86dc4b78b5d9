package com.enterprise.analytics.report.dimension;

import com.enterprise.analytics.report.domain.AdSpendTable;
import com.enterprise.analytics.report.domain.EventTable;
import com.enterprise.analytics.sql.core.Column;

import java.util.Arrays;
import java.util.List;

/**
 * Granularity of the spend join, ordered from least to most specific. A level
 * includes the key columns of every broader level.
 */
public enum JoinSpecificity {
    CAMPAIGN,
    AD_SET,
    AD;

    public Column<String> spendId(AdSpendTable spend) {
        return switch (this) {
            case CAMPAIGN -> spend.CAMPAIGN_ID;
            case AD_SET -> spend.ADSET_ID;
            case AD -> spend.AD_ID;
        };
    }

    public Column<String> spendName(AdSpendTable spend) {
        return switch (this) {
            case CAMPAIGN -> spend.CAMPAIGN_NAME;
            case AD_SET -> spend.ADSET_NAME;
            case AD -> spend.AD_NAME;
        };
    }

    public Column<String> eventColumn(EventTable table) {
        return switch (this) {
            case CAMPAIGN -> table.campaign();
            case AD_SET -> table.adset();
            case AD -> table.ad();
        };
    }

    /** This level and every broader one, broadest first. */
    public List<JoinSpecificity> withBroader() {
        return Arrays.stream(values())
                .filter(s -> s.ordinal() <= ordinal())
                .toList();
    }

    public static JoinSpecificity mostSpecific(JoinSpecificity a, JoinSpecificity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
