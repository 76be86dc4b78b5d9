package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.domain.EngagementColumns;
import com.enterprise.analytics.report.domain.EventTable;

import java.util.Arrays;
import java.util.List;

/**
 * Aggregates emitted by report queries. {@link #id()} is the metric name
 * clients sort by, {@link #alias()} the output column.
 */
public enum Metric {
    PAGE_VIEWS("pageViews", "page_views"),
    UNIQUE_VISITORS("uniqueVisitors", "unique_visitors"),
    BOUNCE_RATE("bounceRate", "bounce_rate"),
    AVG_ACTIVE_TIME("avgActiveTime", "avg_active_time"),
    SCROLL_PAST_HERO("scrollPastHero", "scroll_past_hero"),
    SCROLL_RATE("scrollRate", "scroll_rate"),
    FORM_VIEWS("formViews", "form_views"),
    FORM_VIEW_RATE("formViewRate", "form_view_rate"),
    FORM_STARTERS("formStarters", "form_starters"),
    FORM_START_RATE("formStartRate", "form_start_rate"),
    CTA_CLICKS("ctaClicks", "cta_clicks");

    // active time under this many seconds counts as a bounce
    static final int BOUNCE_SECONDS = 5;

    private final String id;
    private final String alias;

    Metric(String id, String alias) {
        this.id = id;
        this.alias = alias;
    }

    public String id() { return id; }

    public String alias() { return alias; }

    /** Unknown or missing ids sort by page views. */
    public static Metric fromId(String id) {
        return Arrays.stream(values())
                .filter(m -> m.id.equals(id))
                .findFirst()
                .orElse(PAGE_VIEWS);
    }

    public String expression(EventTable table) {
        EngagementColumns e = table.engagement();
        String active = e.activeTimeSeconds().ref();
        String hero = e.heroScrollPassed().ref();
        String formView = e.formView().ref();
        String formStarted = e.formStarted().ref();
        return switch (this) {
            case PAGE_VIEWS -> "COUNT(*)";
            case UNIQUE_VISITORS -> "COUNT(DISTINCT " + table.visitorId().ref() + ")";
            case BOUNCE_RATE -> rate(
                    active + " IS NOT NULL AND " + active + " < " + BOUNCE_SECONDS,
                    "COUNT(*) FILTER (WHERE " + active + " IS NOT NULL)");
            case AVG_ACTIVE_TIME -> "ROUND(CAST(AVG(" + active + ") AS NUMERIC), 2)";
            case SCROLL_PAST_HERO -> countWhere(hero + " = true");
            case SCROLL_RATE -> rate(hero + " = true", "COUNT(*)");
            case FORM_VIEWS -> countWhere(formView + " = true");
            case FORM_VIEW_RATE -> rate(formView + " = true", "COUNT(*)");
            case FORM_STARTERS -> countWhere(formStarted + " = true");
            case FORM_START_RATE -> rate(formStarted + " = true", countWhere(formView + " = true"));
            case CTA_CLICKS -> countWhere(table.ctaClickedPredicate());
        };
    }

    public String selectItem(EventTable table) {
        return expression(table) + " AS " + alias;
    }

    public static List<String> selectAll(EventTable table) {
        return Arrays.stream(values()).map(m -> m.selectItem(table)).toList();
    }

    /**
     * Additive counts for flat queries. Rates are left to the caller, which
     * rebuilds them after summing rows of the client-side hierarchy.
     */
    public static List<String> rawCounts(EventTable table) {
        EngagementColumns e = table.engagement();
        String active = e.activeTimeSeconds().ref();
        return List.of(
                PAGE_VIEWS.selectItem(table),
                UNIQUE_VISITORS.selectItem(table),
                countWhere(active + " IS NOT NULL AND " + active + " < " + BOUNCE_SECONDS) + " AS bounced_count",
                countWhere(active + " IS NOT NULL") + " AS active_time_count",
                "COALESCE(SUM(" + active + "), 0) AS total_active_time",
                SCROLL_PAST_HERO.selectItem(table),
                FORM_VIEWS.selectItem(table),
                FORM_STARTERS.selectItem(table),
                CTA_CLICKS.selectItem(table));
    }

    private static String countWhere(String predicate) {
        return "COUNT(*) FILTER (WHERE " + predicate + ")";
    }

    private static String rate(String numeratorPredicate, String denominator) {
        return "ROUND(CAST(" + countWhere(numeratorPredicate) + " AS NUMERIC) / NULLIF("
                + denominator + ", 0), 4)";
    }
}
