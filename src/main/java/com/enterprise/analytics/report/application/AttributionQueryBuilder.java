package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.dimension.ClassificationDimension;
import com.enterprise.analytics.report.dimension.ColumnScope;
import com.enterprise.analytics.report.dimension.DimensionDescriptor;
import com.enterprise.analytics.report.dimension.DimensionLevel;
import com.enterprise.analytics.report.dimension.DimensionRegistry;
import com.enterprise.analytics.report.dimension.DimensionRenderer;
import com.enterprise.analytics.report.dimension.EnrichedDimension;
import com.enterprise.analytics.report.domain.DateRange;
import com.enterprise.analytics.report.domain.EventTable;
import com.enterprise.analytics.report.domain.QueryRequest;
import com.enterprise.analytics.report.domain.UnknownDimensionException;
import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.builder.SelectBuilder;
import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Dialects;
import com.enterprise.analytics.sql.core.SqlExpression;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.enterprise.analytics.sql.condition.Conditions.isNotNull;
import static com.enterprise.analytics.sql.condition.Conditions.withinDays;

/**
 * Analytics-side halves of the CRM attribution. Both queries read raw tracking
 * columns, never the spend join, because the CRM stores raw ids.
 *
 * <ul>
 *   <li>{@link #buildTrackingMatch}: unique visitors per dimension value and
 *       (normalized source, campaign, ad set, ad) tuple.</li>
 *   <li>{@link #buildVisitorMatch}: distinct (dimension value, visitor id) pairs.</li>
 * </ul>
 */
public class AttributionQueryBuilder {

    private final DimensionRegistry registry;
    private final TableFilterBuilder filterBuilder;

    public AttributionQueryBuilder(DimensionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.filterBuilder = new TableFilterBuilder(registry);
    }

    /** Whether every dimension the request references has a raw event column. */
    public boolean supports(QueryRequest request) {
        return referenced(request).stream()
                .filter(registry::contains)
                .map(registry::resolve)
                .allMatch(AttributionQueryBuilder::hasRawColumn);
    }

    public CompiledQuery buildTrackingMatch(QueryRequest request) {
        RequestValidator.validateDrilldown(request, registry);
        requireRawColumns(request);

        EventTable table = registry.table().unaliased();
        SqlExpression value = dimensionValue(request);
        String source = SourceNormalizer.caseExpression(table.source());
        String campaign = trackingId(table.campaign());
        String adset = trackingId(table.adset());
        String ad = trackingId(table.ad());

        SelectBuilder query = SelectBuilder.query()
                .dialect(Dialects.POSTGRES)
                .select(value.ref() + " AS dimension_value",
                        source + " AS source",
                        campaign + " AS campaign_id",
                        adset + " AS adset_id",
                        ad + " AS ad_id",
                        table.visitorId().countDistinctAs("unique_visitors"))
                .from(table);
        applyFilters(query, request, table);
        return query.groupByExpr(value.ref(), source, campaign, adset, ad).build();
    }

    public CompiledQuery buildVisitorMatch(QueryRequest request) {
        RequestValidator.validateDrilldown(request, registry);
        requireRawColumns(request);

        EventTable table = registry.table().unaliased();
        SqlExpression value = dimensionValue(request);

        SelectBuilder query = SelectBuilder.query()
                .dialect(Dialects.POSTGRES)
                .selectDistinct(value.ref() + " AS dimension_value", table.visitorId().ref())
                .from(table);
        applyFilters(query, request, table);
        return query.where(isNotNull(table.visitorId())).build();
    }

    private void applyFilters(SelectBuilder query, QueryRequest request, EventTable table) {
        DateRange range = request.dateRange();
        ColumnScope scope = ColumnScope.UNQUALIFIED;
        query.where(withinDays(table.occurredAt(), range.start(), range.end()));
        for (Map.Entry<String, String> ancestor : request.ancestorFilters().entrySet()) {
            query.where(DimensionRenderer.parentFilter(
                    registry.resolve(ancestor.getKey()), scope, ancestor.getValue()));
        }
        query.where(filterBuilder.build(request.userFilters(), scope, range));
    }

    // Enriched ids are compared as text on both engines.
    private SqlExpression dimensionValue(QueryRequest request) {
        DimensionDescriptor current = registry.resolve(request.currentDimension());
        SqlExpression value = DimensionRenderer.valueExpression(current, ColumnScope.UNQUALIFIED);
        return current instanceof EnrichedDimension ? value.castText() : value;
    }

    private static String trackingId(Column<String> column) {
        return "COALESCE(" + column.castText().ref() + ", '')";
    }

    private void requireRawColumns(QueryRequest request) {
        for (String id : referenced(request)) {
            DimensionDescriptor d = registry.resolve(id);
            if (!hasRawColumn(d)) {
                throw new UnknownDimensionException(id, "no raw tracking column to attribute on");
            }
        }
    }

    private static boolean hasRawColumn(DimensionDescriptor d) {
        return !(d instanceof ClassificationDimension) && d.level() == DimensionLevel.ENTRY;
    }

    // Levels below the current one play no part in this query.
    private static Set<String> referenced(QueryRequest request) {
        List<String> dims = request.dimensions();
        Integer depth = request.depth();
        int upTo = depth == null ? dims.size() : Math.max(0, Math.min(depth + 1, dims.size()));
        Set<String> ids = new LinkedHashSet<>(dims.subList(0, upTo));
        ids.addAll(request.ancestorFilters().keySet());
        ids.addAll(request.userFilterFields());
        return ids;
    }
}
