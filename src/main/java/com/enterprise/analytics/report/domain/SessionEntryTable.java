package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.Column;

import java.time.LocalDateTime;

/**
 * One row per session, carrying the attributes of the session's first page view.
 */
public final class SessionEntryTable extends EventTable {

    public static final SessionEntryTable SESSION_ENTRIES = new SessionEntryTable("se");

    public final Column<String>        SESSION_ID;
    public final Column<LocalDateTime> SESSION_START;
    public final Column<String>        VISITOR_ID;
    public final Column<String>        ENTRY_URL_PATH;
    public final Column<String>        ENTRY_PAGE_TYPE;
    public final Column<String>        ENTRY_UTM_SOURCE;
    public final Column<String>        ENTRY_UTM_CAMPAIGN;
    public final Column<String>        ENTRY_UTM_CONTENT;
    public final Column<String>        ENTRY_UTM_MEDIUM;
    public final Column<String>        ENTRY_COUNTRY_CODE;
    public final Column<String>        ENTRY_DEVICE_TYPE;
    public final Column<String>        ENTRY_OS_NAME;
    public final Column<String>        ENTRY_BROWSER_NAME;
    public final Column<String>        FUNNEL_ID;
    public final Column<Integer>       VISIT_NUMBER;
    public final Column<Integer>       ENTRY_ACTIVE_TIME_S;
    public final Column<Boolean>       ENTRY_HERO_SCROLL_PASSED;
    public final Column<Boolean>       ENTRY_FORM_VIEW;
    public final Column<Boolean>       ENTRY_FORM_STARTED;
    public final Column<Boolean>       ENTRY_CTA_CLICKED;

    public SessionEntryTable(String alias) {
        super("remote_session_tracker.session_entries", alias);
        this.SESSION_ID               = column("session_id", String.class);
        this.SESSION_START            = column("session_start", LocalDateTime.class);
        this.VISITOR_ID               = column("ff_visitor_id", String.class);
        this.ENTRY_URL_PATH           = column("entry_url_path", String.class);
        this.ENTRY_PAGE_TYPE          = column("entry_page_type", String.class);
        this.ENTRY_UTM_SOURCE         = column("entry_utm_source", String.class);
        this.ENTRY_UTM_CAMPAIGN       = column("entry_utm_campaign", String.class);
        this.ENTRY_UTM_CONTENT        = column("entry_utm_content", String.class);
        this.ENTRY_UTM_MEDIUM         = column("entry_utm_medium", String.class);
        this.ENTRY_COUNTRY_CODE       = column("entry_country_code", String.class);
        this.ENTRY_DEVICE_TYPE        = column("entry_device_type", String.class);
        this.ENTRY_OS_NAME            = column("entry_os_name", String.class);
        this.ENTRY_BROWSER_NAME       = column("entry_browser_name", String.class);
        this.FUNNEL_ID                = column("ff_funnel_id", String.class);
        this.VISIT_NUMBER             = column("visit_number", Integer.class);
        this.ENTRY_ACTIVE_TIME_S      = column("entry_active_time_s", Integer.class);
        this.ENTRY_HERO_SCROLL_PASSED = column("entry_hero_scroll_passed", Boolean.class);
        this.ENTRY_FORM_VIEW          = column("entry_form_view", Boolean.class);
        this.ENTRY_FORM_STARTED       = column("entry_form_started", Boolean.class);
        this.ENTRY_CTA_CLICKED        = column("entry_cta_clicked", Boolean.class);
    }

    @Override public Column<String> urlPath()               { return ENTRY_URL_PATH; }
    @Override public Column<String> source()                { return ENTRY_UTM_SOURCE; }
    @Override public Column<String> campaign()              { return ENTRY_UTM_CAMPAIGN; }
    @Override public Column<String> adset()                 { return ENTRY_UTM_CONTENT; }
    @Override public Column<String> ad()                    { return ENTRY_UTM_MEDIUM; }
    @Override public Column<String> visitorId()             { return VISITOR_ID; }
    @Override public Column<String> sessionId()             { return SESSION_ID; }
    @Override public Column<LocalDateTime> occurredAt()     { return SESSION_START; }

    @Override
    public EngagementColumns engagement() {
        return new EngagementColumns(ENTRY_ACTIVE_TIME_S, ENTRY_HERO_SCROLL_PASSED,
                ENTRY_FORM_VIEW, ENTRY_FORM_STARTED);
    }

    @Override
    public String ctaClickedPredicate() {
        return ENTRY_CTA_CLICKED.ref() + " = true";
    }

    @Override
    public String defaultAlias() {
        return "se";
    }

    @Override
    public SessionEntryTable as(String newAlias) {
        return new SessionEntryTable(newAlias);
    }
}
