package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.dimension.DimensionRegistries;
import com.enterprise.analytics.report.domain.DateRange;
import com.enterprise.analytics.report.domain.FilterOperator;
import com.enterprise.analytics.report.domain.InvalidDepthException;
import com.enterprise.analytics.report.domain.QueryRequest;
import com.enterprise.analytics.report.domain.UnknownDimensionException;
import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.core.Expression;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class AttributionQueryBuilderTest {

    private static final DateRange WEEK = DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7));
    private static final String SOURCE = SourceNormalizer.caseExpression(Expression.of("utm_source", "utm_source"));

    private final AttributionQueryBuilder builder = new AttributionQueryBuilder(DimensionRegistries.PAGE_VIEW);

    private static QueryRequest campaignUnderSource() {
        return QueryRequest.builder(WEEK)
                .dimensions("utmSource", "campaign")
                .depth(1)
                .ancestor("utmSource", "google")
                .build();
    }

    @Test
    void trackingMatchCountsVisitorsPerValueAndTuple() {
        CompiledQuery q = builder.buildTrackingMatch(campaignUnderSource());

        assertThat(q.sql()).isEqualTo("SELECT CAST(utm_campaign AS TEXT) AS dimension_value,"
                + " " + SOURCE + " AS source,"
                + " COALESCE(CAST(utm_campaign AS TEXT), '') AS campaign_id,"
                + " COALESCE(CAST(utm_content AS TEXT), '') AS adset_id,"
                + " COALESCE(CAST(utm_medium AS TEXT), '') AS ad_id,"
                + " COUNT(DISTINCT ff_visitor_id) AS unique_visitors"
                + " FROM remote_session_tracker.event_page_view_enriched_v2"
                + " WHERE created_at >= DATE '2024-01-01' AND created_at < DATE '2024-01-08'"
                + " AND utm_source = :utm_source_1"
                + " GROUP BY CAST(utm_campaign AS TEXT), " + SOURCE + ","
                + " COALESCE(CAST(utm_campaign AS TEXT), ''),"
                + " COALESCE(CAST(utm_content AS TEXT), ''),"
                + " COALESCE(CAST(utm_medium AS TEXT), '')");
        assertThat(q.parameters()).containsExactly("google");
    }

    @Test
    void trackingMatchNeverJoinsSpend() {
        CompiledQuery q = builder.buildTrackingMatch(QueryRequest.builder(WEEK)
                .dimensions("campaign", "adset").depth(1).ancestor("campaign", "111")
                .filter("ad", FilterOperator.EQUALS, "Spring Promo")
                .build());

        assertThat(q.sql()).doesNotContain("JOIN").doesNotContain("pv.");
        assertThat(q.sql()).contains("CAST(utm_content AS TEXT) AS dimension_value",
                "CAST(utm_campaign AS TEXT) = :utm_campaign_1",
                "LOWER(mas_f.ad_name) = :ad_name_3");
    }

    @Test
    void visitorMatchSelectsDistinctPairs() {
        CompiledQuery q = builder.buildVisitorMatch(campaignUnderSource());

        assertThat(q.sql()).isEqualTo("SELECT DISTINCT CAST(utm_campaign AS TEXT) AS dimension_value, ff_visitor_id"
                + " FROM remote_session_tracker.event_page_view_enriched_v2"
                + " WHERE created_at >= DATE '2024-01-01' AND created_at < DATE '2024-01-08'"
                + " AND utm_source = :utm_source_1"
                + " AND ff_visitor_id IS NOT NULL");
    }

    @Test
    void plainDimensionValuesAreNotCast() {
        CompiledQuery q = builder.buildVisitorMatch(QueryRequest.builder(WEEK)
                .dimensions("date", "country").depth(1).ancestor("date", "2024-01-03").build());

        assertThat(q.sql()).startsWith("SELECT DISTINCT country_code AS dimension_value, ff_visitor_id");
        assertThat(q.sql()).contains("AND CAST(created_at AS DATE) = :created_at_1");
        assertThat(q.parameters()).containsExactly(LocalDate.of(2024, 1, 3));
    }

    // ==================== Support ====================

    @Test
    void classificationDimensionsAreNotAttributed() {
        QueryRequest request = QueryRequest.builder(WEEK).dimensions("classifiedProduct", "country").depth(0).build();

        assertThat(builder.supports(request)).isFalse();
        assertThatThrownBy(() -> builder.buildTrackingMatch(request))
                .isInstanceOf(UnknownDimensionException.class)
                .hasMessageContaining("classifiedProduct");
    }

    @Test
    void levelsBelowTheCurrentOneDoNotMatter() {
        QueryRequest request = QueryRequest.builder(WEEK).dimensions("country", "classifiedProduct").depth(0).build();

        assertThat(builder.supports(request)).isTrue();
        assertThatCode(() -> builder.buildVisitorMatch(request)).doesNotThrowAnyException();
    }

    @Test
    void classificationFilterDisablesAttribution() {
        QueryRequest request = QueryRequest.builder(WEEK)
                .dimensions("country").depth(0)
                .filter("classifiedCountry", FilterOperator.EQUALS, "es")
                .build();

        assertThat(builder.supports(request)).isFalse();
    }

    @Test
    void invalidRequestsFailBeforeAttribution() {
        assertThatThrownBy(() -> builder.buildTrackingMatch(
                QueryRequest.builder(WEEK).dimensions("country").depth(3).build()))
                .isInstanceOf(InvalidDepthException.class);
    }
}
