package com.enterprise.analytics.report.dimension;

import com.enterprise.analytics.report.domain.AdSpendTable;
import com.enterprise.analytics.report.domain.DateRange;
import com.enterprise.analytics.report.domain.EventTable;
import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.builder.SelectBuilder;
import com.enterprise.analytics.sql.core.JoinType;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.enterprise.analytics.report.domain.AdSpendTable.AD_SPEND;
import static com.enterprise.analytics.report.domain.ProductTable.PRODUCTS;
import static com.enterprise.analytics.report.domain.UrlClassificationTable.URL_CLASSIFICATIONS;
import static com.enterprise.analytics.sql.condition.Conditions.eqColumn;
import static com.enterprise.analytics.sql.condition.Conditions.isFalse;
import static com.enterprise.analytics.sql.condition.Conditions.withinDays;

/**
 * Joins one query needs, as decided by {@link JoinPlanner}.
 *
 * @param enrichedJoinLevel        spend-join granularity, {@code null} for no spend join
 * @param needsClassificationJoin  whether the URL classification join is required
 * @param eventTable               the unaliased event table of the registry
 */
public record JoinPlan(
    JoinSpecificity enrichedJoinLevel,
    boolean needsClassificationJoin,
    EventTable eventTable
) {

    public boolean hasEnrichedJoin() {
        return enrichedJoinLevel != null;
    }

    public boolean needsJoin() {
        return hasEnrichedJoin() || needsClassificationJoin;
    }

    /** {@code "pv."} style prefix when any join is present, empty otherwise. */
    public String columnPrefix() {
        return needsJoin() ? eventTable.defaultAlias() + "." : "";
    }

    /** The event table as it must appear in FROM. */
    public EventTable source() {
        return needsJoin() ? eventTable.aliased() : eventTable.unaliased();
    }

    public ColumnScope scope() {
        return ColumnScope.single(columnPrefix());
    }

    /**
     * Adds the planned joins to {@code query}. Raw event columns in the ON
     * clauses are qualified through {@code scope}.
     */
    public void applyJoins(SelectBuilder query, DateRange range, ColumnScope scope) {
        if (hasEnrichedJoin()) {
            applySpendJoin(query, range, scope);
        }
        if (needsClassificationJoin) {
            query.join(JoinType.LEFT, URL_CLASSIFICATIONS,
                            eqColumn(scope.qualify(eventTable.urlPath()), URL_CLASSIFICATIONS.URL_PATH),
                            isFalse(URL_CLASSIFICATIONS.IS_IGNORED))
                    .leftJoin(PRODUCTS, URL_CLASSIFICATIONS.PRODUCT_ID, PRODUCTS.ID);
        }
    }

    public void applyJoins(SelectBuilder query, DateRange range) {
        applyJoins(query, range, scope());
    }

    // Grouped by the key columns so each event row matches at most one spend row.
    private void applySpendJoin(SelectBuilder query, DateRange range, ColumnScope scope) {
        AdSpendTable spend = AD_SPEND.as("");
        List<JoinSpecificity> levels = enrichedJoinLevel.withBroader();

        List<String> keys = levels.stream().map(s -> s.spendId(spend).ref()).toList();
        List<String> names = levels.stream()
                .map(s -> s.spendName(spend).maxAs(s.spendName(spend).name()))
                .toList();

        CompiledQuery spendByKey = SelectBuilder.subquery(query.binder())
                .select(concat(keys, names))
                .from(spend)
                .where(withinDays(spend.DATE, range.start(), range.end()))
                .groupByExpr(keys)
                .build();

        String on = levels.stream()
                .map(s -> scope.qualify(s.eventColumn(eventTable)).castText().ref()
                        + " = " + s.spendId(AD_SPEND).castText().ref())
                .collect(Collectors.joining(" AND "));

        query.joinSubquery(JoinType.LEFT, spendByKey, AD_SPEND.alias(), on);
    }

    private static List<String> concat(List<String> a, List<String> b) {
        return Stream.concat(a.stream(), b.stream()).toList();
    }
}
