package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.dimension.ClassificationDimension;
import com.enterprise.analytics.report.dimension.ColumnScope;
import com.enterprise.analytics.report.dimension.DimensionDescriptor;
import com.enterprise.analytics.report.dimension.DimensionLevel;
import com.enterprise.analytics.report.dimension.DimensionRegistry;
import com.enterprise.analytics.report.dimension.DimensionRenderer;
import com.enterprise.analytics.report.dimension.EnrichedDimension;
import com.enterprise.analytics.report.dimension.JoinPlan;
import com.enterprise.analytics.report.dimension.JoinPlanner;
import com.enterprise.analytics.report.dimension.JoinSpecificity;
import com.enterprise.analytics.report.dimension.PlainDimension;
import com.enterprise.analytics.report.domain.DateRange;
import com.enterprise.analytics.report.domain.EventTable;
import com.enterprise.analytics.report.domain.QueryRequest;
import com.enterprise.analytics.report.domain.TableFilter;
import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.builder.SelectBuilder;
import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Dialects;
import com.enterprise.analytics.sql.core.JoinType;
import com.enterprise.analytics.sql.core.NullsOrder;
import com.enterprise.analytics.sql.core.SortDirection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.enterprise.analytics.sql.condition.Conditions.withinDays;

/**
 * Compiles a flat request: one GROUP BY over every requested dimension, so the
 * whole hierarchy comes back in a single round trip.
 *
 * <p>Entry mode aggregates the session-entry table directly. Funnel mode kicks in
 * when an event-level dimension (the funnel step) is requested or filtered on:
 * a {@value #MATCHING_SESSIONS} CTE selects the sessions passing the
 * entry-level filters, and the event table is joined to it and grouped per
 * event.
 *
 * <p>Each dimension is returned under its quoted id, with {@code "<id>_id"} next
 * to it for id/name pairs. Metrics are raw counts ({@link Metric#rawCounts}).
 */
public class FlatQueryCompiler {

    private static final Logger log = LoggerFactory.getLogger(FlatQueryCompiler.class);

    static final String MATCHING_SESSIONS = "matching_sessions";
    static final String SESSION_ALIAS = "ms";

    private final DimensionRegistry registry;
    private final EventTable events;
    private final JoinPlanner planner;
    private final TableFilterBuilder filterBuilder;

    /**
     * @param registry session-entry registry
     * @param events   per-event table joined in funnel mode
     */
    public FlatQueryCompiler(DimensionRegistry registry, EventTable events) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.events = Objects.requireNonNull(events, "events").aliased();
        this.planner = new JoinPlanner(registry);
        this.filterBuilder = new TableFilterBuilder(registry);
    }

    public CompiledQuery compileFlat(QueryRequest request) {
        RequestValidator.validateFlat(request, registry);
        boolean funnel = isFunnel(request);
        CompiledQuery compiled = funnel ? compileFunnel(request) : compileEntry(request);
        log.debug("Compiled flat query over {} ({} mode)", request.dimensions(), funnel ? "funnel" : "entry");
        return compiled;
    }

    boolean isFunnel(QueryRequest request) {
        Set<String> referenced = new LinkedHashSet<>(request.dimensions());
        referenced.addAll(request.userFilterFields());
        return referenced.stream()
                .anyMatch(id -> registry.resolve(id).level() == DimensionLevel.EVENT);
    }

    // ==================== Entry mode ====================

    private CompiledQuery compileEntry(QueryRequest request) {
        DateRange range = request.dateRange();
        Set<String> referenced = new LinkedHashSet<>(request.dimensions());
        referenced.addAll(request.userFilterFields());

        JoinPlan plan = planner.plan(referenced);
        ColumnScope scope = plan.scope();
        EventTable source = plan.source();

        SelectBuilder query = SelectBuilder.query()
                .dialect(Dialects.POSTGRES)
                .select(selectList(request.dimensions(), scope, source))
                .from(source);
        plan.applyJoins(query, range, scope);

        query.where(withinDays(scope.qualify(source.occurredAt()), range.start(), range.end()))
                .where(filterBuilder.build(request.userFilters(), scope, range))
                .groupByExpr(groupByList(request.dimensions(), scope))
                .havingExpr("COUNT(*) > 1")
                .orderByExpr(Metric.PAGE_VIEWS.alias(), SortDirection.DESC, NullsOrder.NULLS_LAST);
        return query.build();
    }

    // ==================== Funnel mode ====================

    private CompiledQuery compileFunnel(QueryRequest request) {
        DateRange range = request.dateRange();
        Map<DimensionLevel, List<TableFilter>> filters = partitionFilters(request.userFilters());

        // Outer joins resolve enriched names and classifications from the CTE's entry columns.
        Set<String> outerReferenced = new LinkedHashSet<>(request.dimensions());
        filters.get(DimensionLevel.EVENT).forEach(f -> outerReferenced.add(f.field()));
        JoinPlan outerPlan = planner.plan(outerReferenced);
        ColumnScope outerScope = ColumnScope.funnel(SESSION_ALIAS, events.alias());

        SelectBuilder query = SelectBuilder.query().dialect(Dialects.POSTGRES);
        CompiledQuery matchingSessions = matchingSessions(query, request, filters.get(DimensionLevel.ENTRY), outerPlan);

        query.with(MATCHING_SESSIONS, matchingSessions)
                .select(selectList(request.dimensions(), outerScope, events))
                .from(events)
                .joinRaw(JoinType.INNER, MATCHING_SESSIONS + " " + SESSION_ALIAS,
                        events.sessionId().ref() + " = " + SESSION_ALIAS + "."
                                + registry.table().sessionId().name());
        outerPlan.applyJoins(query, range, outerScope);

        query.where(withinDays(events.occurredAt(), range.start(), range.end()))
                .where(filterBuilder.build(filters.get(DimensionLevel.EVENT), outerScope, range))
                .groupByExpr(groupByList(request.dimensions(), outerScope))
                .orderByExpr(Metric.PAGE_VIEWS.alias(), SortDirection.DESC, NullsOrder.NULLS_LAST);
        return query.build();
    }

    /**
     * Sessions in range that pass the entry-level filters, with the entry columns
     * the outer query reads.
     */
    private CompiledQuery matchingSessions(SelectBuilder outer, QueryRequest request,
                                           List<TableFilter> entryFilters, JoinPlan outerPlan) {
        DateRange range = request.dateRange();
        boolean classificationFilter = entryFilters.stream()
                .anyMatch(f -> registry.resolve(f.field()) instanceof ClassificationDimension);
        JoinPlan plan = new JoinPlan(null, classificationFilter, registry.table());
        ColumnScope scope = plan.scope();
        EventTable source = plan.source();

        List<String> columns = new ArrayList<>();
        for (Column<?> column : entryColumns(request.dimensions(), outerPlan)) {
            columns.add(scope.qualify(column).ref());
        }

        SelectBuilder cte = SelectBuilder.subquery(outer.binder())
                .dialect(Dialects.POSTGRES)
                .select(columns)
                .from(source);
        plan.applyJoins(cte, range, scope);
        return cte.where(withinDays(scope.qualify(source.occurredAt()), range.start(), range.end()))
                .where(filterBuilder.build(entryFilters, scope, range))
                .build();
    }

    private List<Column<?>> entryColumns(List<String> dimensions, JoinPlan outerPlan) {
        EventTable table = registry.table();
        Map<String, Column<?>> columns = new LinkedHashMap<>();
        columns.put(table.sessionId().name(), table.sessionId());
        for (String id : dimensions) {
            DimensionDescriptor d = registry.resolve(id);
            if (d instanceof PlainDimension p && p.level() == DimensionLevel.ENTRY) {
                columns.putIfAbsent(p.column().name(), p.column());
            }
        }
        if (outerPlan.hasEnrichedJoin()) {
            for (JoinSpecificity level : outerPlan.enrichedJoinLevel().withBroader()) {
                Column<String> raw = level.eventColumn(table);
                columns.putIfAbsent(raw.name(), raw);
            }
        }
        for (String id : dimensions) {
            if (registry.resolve(id) instanceof EnrichedDimension e) {
                columns.putIfAbsent(e.rawColumn().name(), e.rawColumn());
            }
        }
        if (outerPlan.needsClassificationJoin()) {
            columns.putIfAbsent(table.urlPath().name(), table.urlPath());
        }
        return new ArrayList<>(columns.values());
    }

    private Map<DimensionLevel, List<TableFilter>> partitionFilters(List<TableFilter> filters) {
        Map<DimensionLevel, List<TableFilter>> byLevel = new LinkedHashMap<>();
        byLevel.put(DimensionLevel.ENTRY, new ArrayList<>());
        byLevel.put(DimensionLevel.EVENT, new ArrayList<>());
        for (TableFilter f : filters) {
            byLevel.get(registry.resolve(f.field()).level()).add(f);
        }
        return byLevel;
    }

    // ==================== Shared ====================

    private List<String> selectList(List<String> dimensions, ColumnScope scope, EventTable metricsTable) {
        List<String> select = new ArrayList<>();
        for (String id : dimensions) {
            select.addAll(DimensionRenderer.selectColumns(
                    registry.resolve(id), scope, quote(id + "_id"), quote(id)));
        }
        select.addAll(Metric.rawCounts(metricsTable));
        return select;
    }

    private List<String> groupByList(List<String> dimensions, ColumnScope scope) {
        return dimensions.stream()
                .map(id -> DimensionRenderer.groupByExpression(registry.resolve(id), scope))
                .toList();
    }

    private static String quote(String alias) {
        return "\"" + alias + "\"";
    }
}
