package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.domain.DateRange;
import com.enterprise.analytics.report.domain.QueryRequest;
import com.enterprise.analytics.report.domain.ReportQueryException;
import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.builder.SelectBuilder;
import com.enterprise.analytics.sql.condition.Condition;
import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Dialects;
import com.enterprise.analytics.sql.core.Expression;
import com.enterprise.analytics.sql.core.JoinType;
import com.enterprise.analytics.sql.core.SqlExpression;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.enterprise.analytics.report.domain.InvoiceTable.INVOICES;
import static com.enterprise.analytics.report.domain.SourceTable.SOURCES;
import static com.enterprise.analytics.report.domain.SubscriptionTable.SUBSCRIPTIONS;
import static com.enterprise.analytics.sql.condition.Conditions.*;

/**
 * CRM-side halves of the attribution: trial subscriptions created in the date
 * range, with their approved count, grouped by tracking tuple or by visitor.
 *
 * <p>Deleted subscriptions and upsell invoices are excluded. Ancestor filters on
 * tracking dimensions narrow the CRM rows the same way they narrow the
 * analytics rows; ancestors with no CRM counterpart are ignored.
 */
public final class CrmAttributionQueries {

    private static final Logger log = LoggerFactory.getLogger(CrmAttributionQueries.class);

    private CrmAttributionQueries() {}

    static final String UPSELL_TAG = "%parent-sub-id=%";
    static final int TRIAL_INVOICE = 1;

    private static final String TRIALS = "COUNT(DISTINCT " + SUBSCRIPTIONS.ID.ref() + ")";
    private static final String APPROVED = "COUNT(DISTINCT CASE WHEN " + INVOICES.IS_MARKED.ref()
            + " = 1 AND " + INVOICES.DELETED.ref() + " = 0 THEN " + SUBSCRIPTIONS.ID.ref() + " END)";

    public static CompiledQuery trackingRows(DateRange range, Map<String, String> ancestors) {
        String source = SourceNormalizer.caseExpression(SOURCES.SOURCE);
        String campaign = orEmpty(SUBSCRIPTIONS.TRACKING_ID_4);
        String adset = orEmpty(SUBSCRIPTIONS.TRACKING_ID_2);
        String ad = orEmpty(SUBSCRIPTIONS.TRACKING_ID);

        SelectBuilder query = base()
                .select(source + " AS source",
                        campaign + " AS campaign_id",
                        adset + " AS adset_id",
                        ad + " AS ad_id",
                        TRIALS + " AS trials",
                        APPROVED + " AS approved");
        return restrict(query, range, ancestors)
                .groupByExpr(source, campaign, adset, ad)
                .build();
    }

    public static CompiledQuery visitorRows(DateRange range, Map<String, String> ancestors) {
        SelectBuilder query = base()
                .select(SUBSCRIPTIONS.VISITOR_ID.ref(),
                        TRIALS + " AS trials",
                        APPROVED + " AS approved");
        return restrict(query, range, ancestors)
                .where(isNotNull(SUBSCRIPTIONS.VISITOR_ID))
                .groupBy(SUBSCRIPTIONS.VISITOR_ID)
                .build();
    }

    private static SelectBuilder base() {
        return SelectBuilder.query()
                .dialect(Dialects.MARIADB)
                .from(SUBSCRIPTIONS)
                .join(JoinType.INNER, INVOICES,
                        eqColumn(INVOICES.SUBSCRIPTION_ID, SUBSCRIPTIONS.ID),
                        eq(INVOICES.TYPE, TRIAL_INVOICE))
                .leftJoin(SOURCES, SOURCES.ID, SUBSCRIPTIONS.SOURCE_ID);
    }

    private static SelectBuilder restrict(SelectBuilder query, DateRange range, Map<String, String> ancestors) {
        return query
                .where(withinDays(SUBSCRIPTIONS.DATE_CREATE, range.start(), range.end()),
                       eq(SUBSCRIPTIONS.DELETED, 0),
                       or(isNull(INVOICES.TAG), notLike(INVOICES.TAG, UPSELL_TAG)))
                .where(ancestorConditions(ancestors));
    }

    static List<Condition> ancestorConditions(Map<String, String> ancestors) {
        List<Condition> conditions = new ArrayList<>();
        for (Map.Entry<String, String> ancestor : ancestors.entrySet()) {
            Condition c = ancestorCondition(ancestor.getKey(), ancestor.getValue());
            if (c == null) {
                log.debug("No CRM counterpart for ancestor {}, attribution not narrowed", ancestor.getKey());
            }
            conditions.add(c);
        }
        return conditions;
    }

    private static Condition ancestorCondition(String dimensionId, String value) {
        boolean unknown = value == null || QueryRequest.UNKNOWN.equals(value);
        return switch (dimensionId) {
            case "utmSource" -> unknown
                    ? isNull(SOURCES.SOURCE)
                    : in(SOURCES.SOURCE.lower(), SourceNormalizer.variants(value));
            case "campaign" -> trackingId(SUBSCRIPTIONS.TRACKING_ID_4, value, unknown);
            case "adset" -> trackingId(SUBSCRIPTIONS.TRACKING_ID_2, value, unknown);
            case "ad" -> trackingId(SUBSCRIPTIONS.TRACKING_ID, value, unknown);
            case "date" -> unknown ? null : eq(createdDay(), parseDay(value));
            default -> null;
        };
    }

    private static Condition trackingId(Column<String> column, String value, boolean unknown) {
        return unknown ? isNull(column) : eq(column, value);
    }

    private static SqlExpression createdDay() {
        return Expression.of("CAST(" + SUBSCRIPTIONS.DATE_CREATE.ref() + " AS DATE)", "date_create");
    }

    private static LocalDate parseDay(String value) {
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            throw new ReportQueryException(
                    "Invalid date value for date: " + value, e);
        }
    }

    private static String orEmpty(Column<String> column) {
        return "COALESCE(" + column.ref() + ", '')";
    }
}
