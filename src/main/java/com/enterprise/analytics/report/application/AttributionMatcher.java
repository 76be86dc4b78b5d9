package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.domain.Conversions;
import com.enterprise.analytics.report.domain.CrmTrackingRow;
import com.enterprise.analytics.report.domain.CrmVisitorRow;
import com.enterprise.analytics.report.domain.TrackingMatchRow;
import com.enterprise.analytics.report.domain.VisitorMatchRow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Correlates CRM conversions with analytics rows in memory. Results are keyed by
 * {@link #dimensionKey}, so callers look them up with the same normalization.
 */
public final class AttributionMatcher {

    private AttributionMatcher() {}

    static final String KEY_SEPARATOR = "::";
    static final String UNKNOWN_KEY = "unknown";

    /** Parts of the tracking tuple that can be dropped from the match key. */
    public enum TrackingField {
        SOURCE("utmSource"),
        CAMPAIGN("campaign"),
        ADSET("adset"),
        AD("ad");

        private final String dimensionId;

        TrackingField(String dimensionId) {
            this.dimensionId = dimensionId;
        }

        public String dimensionId() {
            return dimensionId;
        }
    }

    /**
     * Tracking fields already fixed by the grouping dimension or an ancestor
     * filter. Keeping them in the key would only match rows that agree on a
     * value the query has already pinned.
     */
    public static Set<TrackingField> excludedFields(String currentDimension, Collection<String> ancestorKeys) {
        Set<TrackingField> excluded = EnumSet.noneOf(TrackingField.class);
        for (TrackingField field : TrackingField.values()) {
            if (field.dimensionId.equals(currentDimension) || ancestorKeys.contains(field.dimensionId)) {
                excluded.add(field);
            }
        }
        return excluded;
    }

    /**
     * {@code source::campaign::adset::ad} without the excluded parts. The CRM
     * stores the literal string {@code "null"} for missing ids; it keys like
     * an empty id.
     */
    public static String trackingKey(String source, String campaignId, String adsetId, String adId,
                                     Set<TrackingField> excluded) {
        List<String> parts = new ArrayList<>(4);
        if (!excluded.contains(TrackingField.SOURCE)) parts.add(SourceNormalizer.normalize(clean(source)));
        if (!excluded.contains(TrackingField.CAMPAIGN)) parts.add(clean(campaignId));
        if (!excluded.contains(TrackingField.ADSET)) parts.add(clean(adsetId));
        if (!excluded.contains(TrackingField.AD)) parts.add(clean(adId));
        return String.join(KEY_SEPARATOR, parts);
    }

    public static String dimensionKey(String dimensionValue) {
        return dimensionValue == null ? UNKNOWN_KEY : dimensionValue.toLowerCase(Locale.ROOT);
    }

    /**
     * Spreads the conversions of each tracking tuple over the dimension values
     * that carried it, in proportion to their unique visitors. Tuples with no
     * analytics rows stay unattributed.
     */
    public static Map<String, Conversions> matchByTracking(List<CrmTrackingRow> crmRows,
                                                           List<TrackingMatchRow> analyticsRows,
                                                           Set<TrackingField> excluded) {
        Map<String, Conversions> crmByKey = new HashMap<>();
        for (CrmTrackingRow row : crmRows) {
            String key = trackingKey(row.source(), row.campaignId(), row.adsetId(), row.adId(), excluded);
            crmByKey.merge(key, row.conversions(), Conversions::plus);
        }

        Map<String, Long> visitorsByKey = new HashMap<>();
        for (TrackingMatchRow row : analyticsRows) {
            visitorsByKey.merge(key(row, excluded), row.uniqueVisitors(), Long::sum);
        }

        Map<String, Conversions> result = new LinkedHashMap<>();
        for (TrackingMatchRow row : analyticsRows) {
            String key = key(row, excluded);
            Conversions crm = crmByKey.get(key);
            if (crm == null) {
                continue;
            }
            long total = visitorsByKey.get(key);
            double share = total == 0 ? 0 : (double) row.uniqueVisitors() / total;
            result.merge(dimensionKey(row.dimensionValue()), crm.scaled(share), Conversions::plus);
        }
        return result;
    }

    /**
     * Credits each CRM visitor to the dimension values they appeared under,
     * split evenly so one conversion is never counted twice.
     */
    public static Map<String, Conversions> matchByVisitor(List<CrmVisitorRow> crmRows,
                                                          List<VisitorMatchRow> analyticsRows) {
        Map<String, Conversions> crmByVisitor = new HashMap<>();
        for (CrmVisitorRow row : crmRows) {
            if (row.visitorId() != null) {
                crmByVisitor.merge(row.visitorId(), row.conversions(), Conversions::plus);
            }
        }

        Map<String, Integer> valuesPerVisitor = new HashMap<>();
        for (VisitorMatchRow row : analyticsRows) {
            if (crmByVisitor.containsKey(row.visitorId())) {
                valuesPerVisitor.merge(row.visitorId(), 1, Integer::sum);
            }
        }

        Map<String, Conversions> result = new LinkedHashMap<>();
        for (VisitorMatchRow row : analyticsRows) {
            Conversions crm = crmByVisitor.get(row.visitorId());
            if (crm == null) {
                continue;
            }
            double share = 1.0 / valuesPerVisitor.get(row.visitorId());
            result.merge(dimensionKey(row.dimensionValue()), crm.scaled(share), Conversions::plus);
        }
        return result;
    }

    private static String key(TrackingMatchRow row, Set<TrackingField> excluded) {
        return trackingKey(row.source(), row.campaignId(), row.adsetId(), row.adId(), excluded);
    }

    private static String clean(String value) {
        return value == null || "null".equals(value) ? "" : value;
    }
}
