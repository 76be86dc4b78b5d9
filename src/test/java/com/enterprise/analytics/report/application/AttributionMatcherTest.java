package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.application.AttributionMatcher.TrackingField;
import com.enterprise.analytics.report.domain.Conversions;
import com.enterprise.analytics.report.domain.CrmTrackingRow;
import com.enterprise.analytics.report.domain.CrmVisitorRow;
import com.enterprise.analytics.report.domain.TrackingMatchRow;
import com.enterprise.analytics.report.domain.VisitorMatchRow;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class AttributionMatcherTest {

    private static final Set<TrackingField> NONE = EnumSet.noneOf(TrackingField.class);

    // ==================== Keys ====================

    @Test
    void currentDimensionAndAncestorsAreExcludedFromTheKey() {
        assertThat(AttributionMatcher.excludedFields("adset", List.of("utmSource", "campaign")))
                .containsExactly(TrackingField.SOURCE, TrackingField.CAMPAIGN, TrackingField.ADSET);
        assertThat(AttributionMatcher.excludedFields("country", List.of())).isEmpty();
    }

    @Test
    void trackingKeyNormalizesSourceAndMissingIds() {
        assertThat(AttributionMatcher.trackingKey("Adwords", "123", "null", null, NONE))
                .isEqualTo("google::123::::");
        assertThat(AttributionMatcher.trackingKey("fb", "123", "456", "789",
                EnumSet.of(TrackingField.SOURCE, TrackingField.CAMPAIGN)))
                .isEqualTo("456::789");
    }

    @Test
    void dimensionKeyIsCaseInsensitiveAndNamesNull() {
        assertThat(AttributionMatcher.dimensionKey("ES")).isEqualTo("es");
        assertThat(AttributionMatcher.dimensionKey(null)).isEqualTo("unknown");
    }

    // ==================== Tracking match ====================

    @Test
    void conversionsAreSplitByUniqueVisitorShare() {
        List<CrmTrackingRow> crm = List.of(
                new CrmTrackingRow("google", "111", "a", "x", 2, 1),
                new CrmTrackingRow("adwords", "111", "a", "x", 1, 0));
        List<TrackingMatchRow> analytics = List.of(
                new TrackingMatchRow("ES", "google", "111", "a", "x", 30),
                new TrackingMatchRow("FR", "google", "111", "a", "x", 10),
                new TrackingMatchRow("DE", "facebook", "9", "b", "y", 5));

        Map<String, Conversions> result = AttributionMatcher.matchByTracking(crm, analytics, NONE);

        assertThat(result).containsOnlyKeys("es", "fr");
        assertThat(result.get("es")).isEqualTo(new Conversions(2.25, 0.75));
        assertThat(result.get("fr")).isEqualTo(new Conversions(0.75, 0.25));
    }

    @Test
    void excludedFieldsWidenTheMatch() {
        List<CrmTrackingRow> crm = List.of(new CrmTrackingRow("google", "111", "", "", 4, 2));
        List<TrackingMatchRow> analytics = List.of(
                new TrackingMatchRow("111", "google", "111", "", "", 3),
                new TrackingMatchRow("222", "google", "222", "", "", 1));

        Map<String, Conversions> strict = AttributionMatcher.matchByTracking(crm, analytics, NONE);
        Map<String, Conversions> wide = AttributionMatcher.matchByTracking(crm, analytics,
                EnumSet.of(TrackingField.CAMPAIGN));

        assertThat(strict).containsOnlyKeys("111");
        assertThat(strict.get("111")).isEqualTo(new Conversions(4, 2));
        assertThat(wide.get("111")).isEqualTo(new Conversions(3, 1.5));
        assertThat(wide.get("222")).isEqualTo(new Conversions(1, 0.5));
    }

    @Test
    void nullDimensionValuesAccumulateUnderUnknown() {
        List<CrmTrackingRow> crm = List.of(new CrmTrackingRow("google", "1", "", "", 2, 2));
        List<TrackingMatchRow> analytics = List.of(
                new TrackingMatchRow(null, "google", "1", "", "", 1),
                new TrackingMatchRow(null, "google", "1", "null", "", 1));

        assertThat(AttributionMatcher.matchByTracking(crm, analytics, NONE))
                .containsExactly(entry("unknown", new Conversions(2, 2)));
    }

    @Test
    void zeroVisitorsAttributeNothing() {
        List<CrmTrackingRow> crm = List.of(new CrmTrackingRow("google", "1", "", "", 5, 1));
        List<TrackingMatchRow> analytics = List.of(new TrackingMatchRow("ES", "google", "1", "", "", 0));

        assertThat(AttributionMatcher.matchByTracking(crm, analytics, NONE).get("es"))
                .isEqualTo(Conversions.NONE);
    }

    // ==================== Visitor match ====================

    @Test
    void visitorConversionsAreSplitEvenlyAcrossTheirValues() {
        List<CrmVisitorRow> crm = List.of(
                new CrmVisitorRow("v1", 2, 1),
                new CrmVisitorRow("v2", 1, 0));
        List<VisitorMatchRow> analytics = List.of(
                new VisitorMatchRow("ES", "v1"),
                new VisitorMatchRow("FR", "v1"),
                new VisitorMatchRow("es", "v2"),
                new VisitorMatchRow("DE", "v3"));

        Map<String, Conversions> result = AttributionMatcher.matchByVisitor(crm, analytics);

        assertThat(result).containsOnlyKeys("es", "fr");
        assertThat(result.get("es")).isEqualTo(new Conversions(2, 0.5));
        assertThat(result.get("fr")).isEqualTo(new Conversions(1, 0.5));
    }

    @Test
    void noCrmVisitorsMeansNoAttribution() {
        List<VisitorMatchRow> analytics = List.of(new VisitorMatchRow("ES", "v1"));

        assertThat(AttributionMatcher.matchByVisitor(List.of(), analytics)).isEmpty();
        assertThat(AttributionMatcher.matchByVisitor(List.of(new CrmVisitorRow(null, 1, 1)), analytics)).isEmpty();
    }
}
