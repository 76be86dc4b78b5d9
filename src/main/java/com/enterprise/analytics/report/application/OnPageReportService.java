package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.domain.Conversions;
import com.enterprise.analytics.report.domain.CrmTrackingRow;
import com.enterprise.analytics.report.domain.CrmVisitorRow;
import com.enterprise.analytics.report.domain.QueryRequest;
import com.enterprise.analytics.report.domain.ReportRow;
import com.enterprise.analytics.report.domain.TrackingMatchRow;
import com.enterprise.analytics.report.domain.VisitorMatchRow;
import com.enterprise.analytics.shared.querybridge.port.ReportQueryExecutor;
import com.enterprise.analytics.sql.builder.CompiledQuery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * On-page drill-down: one hierarchy level of analytics metrics, each row
 * carrying the CRM trials and approvals attributed to it.
 *
 * <p>All queries are compiled up front, so invalid requests fail before any I/O.
 * They then run in parallel. Each source is isolated: a
 * {@link DataAccessException} from one query is logged and that part of the
 * report comes back empty.
 */
public class OnPageReportService {

    private static final Logger log = LoggerFactory.getLogger(OnPageReportService.class);

    private final DrilldownQueryCompiler compiler;
    private final AttributionQueryBuilder attribution;
    private final ReportQueryExecutor analytics;
    private final ReportQueryExecutor crm;
    private final Executor executor;

    public OnPageReportService(DrilldownQueryCompiler compiler,
                               AttributionQueryBuilder attribution,
                               ReportQueryExecutor analytics,
                               ReportQueryExecutor crm,
                               Executor executor) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.attribution = Objects.requireNonNull(attribution, "attribution");
        this.analytics = Objects.requireNonNull(analytics, "analytics");
        this.crm = Objects.requireNonNull(crm, "crm");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public List<ReportRow> drilldown(QueryRequest request) {
        CompiledQuery metricsQuery = compiler.compile(request);
        boolean attributed = attribution.supports(request);

        CompletableFuture<List<Map<String, Object>>> metrics = fetch("analytics", analytics, metricsQuery);
        CompletableFuture<List<Map<String, Object>>> trackingMatch = completedEmpty();
        CompletableFuture<List<Map<String, Object>>> visitorMatch = completedEmpty();
        CompletableFuture<List<Map<String, Object>>> crmTracking = completedEmpty();
        CompletableFuture<List<Map<String, Object>>> crmVisitors = completedEmpty();

        if (attributed) {
            CompiledQuery trackingQuery = attribution.buildTrackingMatch(request);
            CompiledQuery visitorQuery = attribution.buildVisitorMatch(request);
            CompiledQuery crmTrackingQuery = CrmAttributionQueries.trackingRows(
                    request.dateRange(), request.ancestorFilters());
            CompiledQuery crmVisitorQuery = CrmAttributionQueries.visitorRows(
                    request.dateRange(), request.ancestorFilters());

            trackingMatch = fetch("analytics tracking match", analytics, trackingQuery);
            visitorMatch = fetch("analytics visitor match", analytics, visitorQuery);
            crmTracking = fetch("crm tracking", crm, crmTrackingQuery);
            crmVisitors = fetch("crm visitors", crm, crmVisitorQuery);
        } else {
            log.debug("Attribution skipped for {}: a referenced dimension has no raw tracking column",
                    request.dimensions());
        }

        Set<AttributionMatcher.TrackingField> excluded = AttributionMatcher.excludedFields(
                request.currentDimension(), request.ancestorFilters().keySet());
        Map<String, Conversions> byTracking = AttributionMatcher.matchByTracking(
                await(crmTracking).stream().map(CrmTrackingRow::fromRow).toList(),
                await(trackingMatch).stream().map(TrackingMatchRow::fromRow).toList(),
                excluded);
        Map<String, Conversions> byVisitor = AttributionMatcher.matchByVisitor(
                await(crmVisitors).stream().map(CrmVisitorRow::fromRow).toList(),
                await(visitorMatch).stream().map(VisitorMatchRow::fromRow).toList());

        List<ReportRow> rows = new ArrayList<>();
        for (Map<String, Object> row : await(metrics)) {
            rows.add(toReportRow(row, byTracking, byVisitor));
        }
        return rows;
    }

    // Attribution keys on the raw value: dimension_id when present, else dimension_value.
    private static ReportRow toReportRow(Map<String, Object> row,
                                         Map<String, Conversions> byTracking,
                                         Map<String, Conversions> byVisitor) {
        String id = text(row.get(DrilldownQueryCompiler.ID_ALIAS));
        String value = text(row.get(DrilldownQueryCompiler.VALUE_ALIAS));
        boolean hasId = row.containsKey(DrilldownQueryCompiler.ID_ALIAS);
        String key = AttributionMatcher.dimensionKey(hasId ? id : value);

        Map<String, Object> metrics = new LinkedHashMap<>();
        for (Metric m : Metric.values()) {
            metrics.put(m.id(), row.get(m.alias()));
        }
        return new ReportRow(id,
                value == null ? QueryRequest.UNKNOWN : value,
                metrics,
                byTracking.getOrDefault(key, Conversions.NONE),
                byVisitor.getOrDefault(key, Conversions.NONE));
    }

    private CompletableFuture<List<Map<String, Object>>> fetch(String source, ReportQueryExecutor target,
                                                              CompiledQuery query) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return target.queryForRows(query);
            } catch (DataAccessException e) {
                log.warn("Source '{}' failed, continuing without it: {}", source, e.getMessage());
                return List.of();
            }
        }, executor);
    }

    private static CompletableFuture<List<Map<String, Object>>> completedEmpty() {
        return CompletableFuture.completedFuture(List.of());
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
