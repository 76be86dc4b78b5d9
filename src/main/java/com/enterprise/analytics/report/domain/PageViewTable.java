package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.Column;

import java.time.LocalDateTime;

public final class PageViewTable extends EventTable {

    public static final PageViewTable PAGE_VIEWS = new PageViewTable("pv");

    public final Column<String>        URL_PATH;
    public final Column<String>        PAGE_TYPE;
    public final Column<String>        UTM_SOURCE;
    public final Column<String>        UTM_CAMPAIGN;
    public final Column<String>        UTM_CONTENT;
    public final Column<String>        UTM_MEDIUM;
    public final Column<String>        DEVICE_TYPE;
    public final Column<String>        OS_NAME;
    public final Column<String>        BROWSER_NAME;
    public final Column<String>        COUNTRY_CODE;
    public final Column<LocalDateTime> CREATED_AT;
    public final Column<String>        VISITOR_ID;
    public final Column<String>        SESSION_ID;
    public final Column<Integer>       ACTIVE_TIME_S;
    public final Column<Boolean>       HERO_SCROLL_PASSED;
    public final Column<Boolean>       FORM_VIEW;
    public final Column<Boolean>       FORM_STARTED;
    public final Column<String>        PAGE_ELEMENTS;

    public PageViewTable(String alias) {
        super("remote_session_tracker.event_page_view_enriched_v2", alias);
        this.URL_PATH           = column("url_path", String.class);
        this.PAGE_TYPE          = column("page_type", String.class);
        this.UTM_SOURCE         = column("utm_source", String.class);
        this.UTM_CAMPAIGN       = column("utm_campaign", String.class);
        this.UTM_CONTENT        = column("utm_content", String.class);
        this.UTM_MEDIUM         = column("utm_medium", String.class);
        this.DEVICE_TYPE        = column("device_type", String.class);
        this.OS_NAME            = column("os_name", String.class);
        this.BROWSER_NAME       = column("browser_name", String.class);
        this.COUNTRY_CODE       = column("country_code", String.class);
        this.CREATED_AT         = column("created_at", LocalDateTime.class);
        this.VISITOR_ID         = column("ff_visitor_id", String.class);
        this.SESSION_ID         = column("session_id", String.class);
        this.ACTIVE_TIME_S      = column("active_time_s", Integer.class);
        this.HERO_SCROLL_PASSED = column("hero_scroll_passed", Boolean.class);
        this.FORM_VIEW          = column("form_view", Boolean.class);
        this.FORM_STARTED       = column("form_started", Boolean.class);
        this.PAGE_ELEMENTS      = column("page_elements", String.class);
    }

    @Override public Column<String> urlPath()               { return URL_PATH; }
    @Override public Column<String> source()                { return UTM_SOURCE; }
    @Override public Column<String> campaign()              { return UTM_CAMPAIGN; }
    @Override public Column<String> adset()                 { return UTM_CONTENT; }
    @Override public Column<String> ad()                    { return UTM_MEDIUM; }
    @Override public Column<String> visitorId()             { return VISITOR_ID; }
    @Override public Column<String> sessionId()             { return SESSION_ID; }
    @Override public Column<LocalDateTime> occurredAt()     { return CREATED_AT; }

    @Override
    public EngagementColumns engagement() {
        return new EngagementColumns(ACTIVE_TIME_S, HERO_SCROLL_PASSED, FORM_VIEW, FORM_STARTED);
    }

    // page_elements is jsonb keyed by element id; CTA entries carry a "clicked" flag
    @Override
    public String ctaClickedPredicate() {
        String elements = PAGE_ELEMENTS.ref();
        return elements + " IS NOT NULL AND CAST(" + elements + " AS TEXT) LIKE '%cta%'"
                + " AND EXISTS (SELECT 1 FROM jsonb_each(" + elements + ") AS pe(k, v)"
                + " WHERE k ILIKE '%cta%' AND v->>'clicked' = 'true')";
    }

    @Override
    public String defaultAlias() {
        return "pv";
    }

    @Override
    public PageViewTable as(String newAlias) {
        return new PageViewTable(newAlias);
    }
}
