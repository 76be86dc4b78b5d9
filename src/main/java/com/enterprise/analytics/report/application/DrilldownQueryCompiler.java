package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.dimension.ColumnScope;
import com.enterprise.analytics.report.dimension.DimensionDescriptor;
import com.enterprise.analytics.report.dimension.DimensionLevel;
import com.enterprise.analytics.report.dimension.DimensionRegistry;
import com.enterprise.analytics.report.dimension.DimensionRenderer;
import com.enterprise.analytics.report.dimension.JoinPlan;
import com.enterprise.analytics.report.dimension.JoinPlanner;
import com.enterprise.analytics.report.dimension.PlainDimension;
import com.enterprise.analytics.report.dimension.ValueType;
import com.enterprise.analytics.report.domain.DateRange;
import com.enterprise.analytics.report.domain.EventTable;
import com.enterprise.analytics.report.domain.QueryRequest;
import com.enterprise.analytics.report.domain.ReportQueryException;
import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.builder.SelectBuilder;
import com.enterprise.analytics.sql.core.Dialects;
import com.enterprise.analytics.sql.core.NullsOrder;
import com.enterprise.analytics.sql.core.SortDirection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.enterprise.analytics.sql.condition.Conditions.withinDays;

/**
 * Compiles a depth-recursive request into the aggregate query for one level of
 * the hierarchy: grouped by {@code dimensions[depth]}, restricted to the rows
 * under the ancestor keys and the user filters.
 *
 * <p>Output columns are {@code dimension_value}, {@code dimension_id} for
 * dimensions with an id/name pair, then one column per {@link Metric}.
 */
public class DrilldownQueryCompiler {

    private static final Logger log = LoggerFactory.getLogger(DrilldownQueryCompiler.class);

    static final int DEFAULT_LIMIT = 1000;
    static final int MAX_LIMIT = 10_000;

    static final String ID_ALIAS = "dimension_id";
    static final String VALUE_ALIAS = "dimension_value";

    private final DimensionRegistry registry;
    private final JoinPlanner planner;
    private final TableFilterBuilder filterBuilder;

    public DrilldownQueryCompiler(DimensionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.planner = new JoinPlanner(registry);
        this.filterBuilder = new TableFilterBuilder(registry);
    }

    public DimensionRegistry registry() {
        return registry;
    }

    public CompiledQuery compile(QueryRequest request) {
        RequestValidator.validateDrilldown(request, registry);
        rejectEventLevel(request);

        String currentId = request.currentDimension();
        DimensionDescriptor current = registry.resolve(currentId);
        DateRange range = request.dateRange();

        JoinPlan plan = planner.plan(currentId,
                request.ancestorFilters().keySet(), request.userFilterFields());
        ColumnScope scope = plan.scope();
        EventTable source = plan.source();

        List<String> select = new ArrayList<>(
                DimensionRenderer.selectColumns(current, scope, ID_ALIAS, VALUE_ALIAS));
        select.addAll(Metric.selectAll(source));

        SelectBuilder query = SelectBuilder.query()
                .dialect(Dialects.POSTGRES)
                .select(select)
                .from(source);
        plan.applyJoins(query, range, scope);

        query.where(withinDays(scope.qualify(source.occurredAt()), range.start(), range.end()));
        for (Map.Entry<String, String> ancestor : request.ancestorFilters().entrySet()) {
            DimensionDescriptor d = registry.resolve(ancestor.getKey());
            query.where(DimensionRenderer.parentFilter(d, scope, ancestor.getValue()));
        }
        query.where(filterBuilder.build(request.userFilters(), scope, range));

        query.groupByExpr(DimensionRenderer.groupByExpression(current, scope));
        if (isDate(current)) {
            query.orderByExpr(VALUE_ALIAS, SortDirection.DESC, NullsOrder.NULLS_LAST);
        } else {
            query.orderByExpr(Metric.fromId(request.sortBy()).alias(),
                    request.sortDirection(), NullsOrder.NULLS_LAST);
        }
        query.limit(clampLimit(request.limit()));

        CompiledQuery compiled = query.build();
        log.debug("Compiled drill-down level {} ({}) with {} parameters",
                request.depth(), currentId, compiled.namedParameters().size());
        return compiled;
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    private void rejectEventLevel(QueryRequest request) {
        Set<String> referenced = new LinkedHashSet<>(request.dimensions());
        referenced.addAll(request.userFilterFields());
        for (String id : referenced) {
            if (registry.resolve(id).level() == DimensionLevel.EVENT) {
                throw new ReportQueryException(
                        "Dimension " + id + " is only available in flat queries");
            }
        }
    }

    private static boolean isDate(DimensionDescriptor d) {
        return d instanceof PlainDimension p && p.valueType() == ValueType.DATE;
    }
}
