package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.dimension.ColumnScope;
import com.enterprise.analytics.report.dimension.DimensionDescriptor;
import com.enterprise.analytics.report.dimension.DimensionRegistry;
import com.enterprise.analytics.report.dimension.DimensionRenderer;
import com.enterprise.analytics.report.dimension.EnrichedDimension;
import com.enterprise.analytics.report.domain.AdSpendTable;
import com.enterprise.analytics.report.domain.DateRange;
import com.enterprise.analytics.report.domain.FilterOperator;
import com.enterprise.analytics.report.domain.QueryRequest;
import com.enterprise.analytics.report.domain.TableFilter;
import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.builder.SelectBuilder;
import com.enterprise.analytics.sql.condition.Condition;
import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.SqlExpression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static com.enterprise.analytics.report.domain.AdSpendTable.AD_SPEND;
import static com.enterprise.analytics.sql.condition.Conditions.*;

/**
 * Turns user-typed filters into one WHERE condition.
 *
 * <p>Filters on the same field are OR'ed, fields are AND'ed in the order they
 * first appear. Comparisons are case-insensitive. Negated operators keep rows
 * whose value is NULL. For enriched dimensions each comparison also matches ids
 * whose display name in the spend source (same date range) matches the value,
 * so a user can filter by id or by name.
 */
public class TableFilterBuilder {

    static final String LOOKUP_ALIAS = "mas_f";

    private final DimensionRegistry registry;

    public TableFilterBuilder(DimensionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @return the combined condition, or {@code null} when no filter produces one
     */
    public Condition build(List<TableFilter> filters, ColumnScope scope, DateRange range) {
        Map<String, List<TableFilter>> byField = new LinkedHashMap<>();
        for (TableFilter f : filters) {
            byField.computeIfAbsent(f.field(), k -> new ArrayList<>()).add(f);
        }

        List<Condition> perField = new ArrayList<>();
        for (Map.Entry<String, List<TableFilter>> entry : byField.entrySet()) {
            DimensionDescriptor d = registry.resolve(entry.getKey());
            List<Condition> alternatives = new ArrayList<>();
            for (TableFilter f : entry.getValue()) {
                alternatives.add(single(d, f, scope, range));
            }
            perField.add(orIfAny(alternatives));
        }
        return andIfAny(perField);
    }

    private Condition single(DimensionDescriptor d, TableFilter filter, ColumnScope scope, DateRange range) {
        FilterOperator op = filter.operator();
        String value = filter.value().trim();
        SqlExpression nullTarget = DimensionRenderer.nullTarget(d, scope);

        if (op.acceptsEmptyValue() && (value.isEmpty() || QueryRequest.UNKNOWN.equals(value))) {
            return op == FilterOperator.EQUALS ? isNull(nullTarget) : isNotNull(nullTarget);
        }
        if (value.isEmpty()) {
            return null;
        }

        String needle = value.toLowerCase(Locale.ROOT);
        SqlExpression target = DimensionRenderer.filterTarget(d, scope);
        EnrichedDimension enriched = d instanceof EnrichedDimension e ? e : null;

        Condition direct = switch (op) {
            case EQUALS -> eq(target, needle);
            case NOT_EQUALS -> neq(target, needle);
            case CONTAINS -> contains(target, needle);
            case NOT_CONTAINS -> notContains(target, needle);
        };
        if (!op.isNegated()) {
            return enriched == null ? direct
                    : or(direct, nameLookup(enriched, scope, op, needle, range));
        }
        Condition mismatch = enriched == null ? direct
                : and(direct, nameLookup(enriched, scope, op, needle, range));
        return or(isNull(nullTarget), mismatch);
    }

    /**
     * {@code raw [NOT] IN (SELECT DISTINCT id FROM spend WHERE name matches)}.
     * Rendered lazily so the subquery binds on the enclosing query's binder.
     */
    private Condition nameLookup(EnrichedDimension d, ColumnScope scope, FilterOperator op,
                                 String needle, DateRange range) {
        SqlExpression rawText = scope.qualify(d.rawColumn()).castText();
        return binder -> {
            AdSpendTable lookup = AD_SPEND.as(LOOKUP_ALIAS);
            Column<String> id = d.specificity().spendId(lookup);
            SqlExpression name = d.specificity().spendName(lookup).lower();
            Condition nameMatches = (op == FilterOperator.EQUALS || op == FilterOperator.NOT_EQUALS)
                    ? eq(name, needle)
                    : contains(name, needle);

            CompiledQuery ids = SelectBuilder.subquery(binder)
                    .selectDistinct(id.castText().ref())
                    .from(lookup)
                    .where(withinDays(lookup.DATE, range.start(), range.end()),
                           isNotNull(id),
                           nameMatches)
                    .build();
            Condition membership = op.isNegated() ? notInSubquery(rawText, ids) : inSubquery(rawText, ids);
            return membership.toSql(binder);
        };
    }
}
