package com.enterprise.analytics.report.dimension;

import com.enterprise.analytics.report.domain.EventTable;

import java.util.List;

import static com.enterprise.analytics.report.domain.PageViewTable.PAGE_VIEWS;
import static com.enterprise.analytics.report.domain.ProductTable.PRODUCTS;
import static com.enterprise.analytics.report.domain.SessionEntryTable.SESSION_ENTRIES;
import static com.enterprise.analytics.report.domain.UrlClassificationTable.URL_CLASSIFICATIONS;

/**
 * The two dimension tables of the reporting layer: page views (on-page report,
 * drill-down) and session entries (session report, flat).
 */
public final class DimensionRegistries {

    private DimensionRegistries() {}

    public static final String FUNNEL_STEP = "funnelStep";

    public static final DimensionRegistry PAGE_VIEW = pageViews();

    public static final DimensionRegistry SESSION = sessions();

    private static DimensionRegistry pageViews() {
        EventTable pv = PAGE_VIEWS.unaliased();
        return new DimensionRegistry(pv, List.of(
                PlainDimension.text("urlPath", PAGE_VIEWS.URL_PATH),
                PlainDimension.text("pageType", PAGE_VIEWS.PAGE_TYPE),
                PlainDimension.text("utmSource", PAGE_VIEWS.UTM_SOURCE),
                new EnrichedDimension("campaign", JoinSpecificity.CAMPAIGN, PAGE_VIEWS.UTM_CAMPAIGN),
                new EnrichedDimension("adset", JoinSpecificity.AD_SET, PAGE_VIEWS.UTM_CONTENT),
                new EnrichedDimension("ad", JoinSpecificity.AD, PAGE_VIEWS.UTM_MEDIUM),
                PlainDimension.text("utmContent", PAGE_VIEWS.UTM_CONTENT),
                PlainDimension.text("utmMedium", PAGE_VIEWS.UTM_MEDIUM),
                PlainDimension.text("deviceType", PAGE_VIEWS.DEVICE_TYPE),
                PlainDimension.text("osName", PAGE_VIEWS.OS_NAME),
                PlainDimension.text("browserName", PAGE_VIEWS.BROWSER_NAME),
                PlainDimension.text("country", PAGE_VIEWS.COUNTRY_CODE),
                PlainDimension.day("date", PAGE_VIEWS.CREATED_AT),
                classifiedProduct("classifiedProduct"),
                classifiedCountry("classifiedCountry")));
    }

    private static DimensionRegistry sessions() {
        EventTable se = SESSION_ENTRIES.unaliased();
        return new DimensionRegistry(se, List.of(
                PlainDimension.url("entryUrlPath", SESSION_ENTRIES.ENTRY_URL_PATH),
                PlainDimension.text("entryPageType", SESSION_ENTRIES.ENTRY_PAGE_TYPE),
                PlainDimension.text("entryUtmSource", SESSION_ENTRIES.ENTRY_UTM_SOURCE),
                new EnrichedDimension("entryCampaign", JoinSpecificity.CAMPAIGN, SESSION_ENTRIES.ENTRY_UTM_CAMPAIGN),
                new EnrichedDimension("entryAdset", JoinSpecificity.AD_SET, SESSION_ENTRIES.ENTRY_UTM_CONTENT),
                new EnrichedDimension("entryAd", JoinSpecificity.AD, SESSION_ENTRIES.ENTRY_UTM_MEDIUM),
                PlainDimension.text("entryCountryCode", SESSION_ENTRIES.ENTRY_COUNTRY_CODE),
                PlainDimension.text("entryDeviceType", SESSION_ENTRIES.ENTRY_DEVICE_TYPE),
                PlainDimension.text("entryOsName", SESSION_ENTRIES.ENTRY_OS_NAME),
                PlainDimension.text("entryBrowserName", SESSION_ENTRIES.ENTRY_BROWSER_NAME),
                PlainDimension.text("funnelId", SESSION_ENTRIES.FUNNEL_ID),
                PlainDimension.number("visitNumber", SESSION_ENTRIES.VISIT_NUMBER),
                PlainDimension.day("date", SESSION_ENTRIES.SESSION_START),
                classifiedProduct("entryProduct"),
                PlainDimension.eventUrl(FUNNEL_STEP, PAGE_VIEWS.URL_PATH)));
    }

    private static ClassificationDimension classifiedProduct(String id) {
        return new ClassificationDimension(id,
                PRODUCTS.ID.castText().ref(),
                "COALESCE(MAX(" + PRODUCTS.NAME.ref() + "), 'Unknown')",
                PRODUCTS.ID.ref(),
                PRODUCTS.ID.castText().ref(),
                PRODUCTS.NAME.lower().ref());
    }

    private static ClassificationDimension classifiedCountry(String id) {
        return new ClassificationDimension(id,
                null,
                "COALESCE(" + URL_CLASSIFICATIONS.COUNTRY_CODE.ref() + ", 'Unknown')",
                URL_CLASSIFICATIONS.COUNTRY_CODE.ref(),
                URL_CLASSIFICATIONS.COUNTRY_CODE.ref(),
                URL_CLASSIFICATIONS.COUNTRY_CODE.lower().ref());
    }
}
