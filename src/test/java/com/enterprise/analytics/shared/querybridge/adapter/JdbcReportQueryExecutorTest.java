package com.enterprise.analytics.shared.querybridge.adapter;

import com.enterprise.analytics.report.application.CrmAttributionQueries;
import com.enterprise.analytics.report.domain.CrmTrackingRow;
import com.enterprise.analytics.report.domain.CrmVisitorRow;
import com.enterprise.analytics.report.domain.DateRange;
import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.builder.SelectBuilder;
import com.enterprise.analytics.sql.core.SortDirection;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.enterprise.analytics.report.domain.SubscriptionTable.SUBSCRIPTIONS;
import static com.enterprise.analytics.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Runs the CRM attribution queries against an in-memory database.
 */
class JdbcReportQueryExecutorTest {

    private static final DateRange WEEK = DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7));

    private EmbeddedDatabase db;
    private JdbcReportQueryExecutor executor;

    @BeforeEach
    void setUp() {
        db = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("db/crm-schema.sql")
                .addScript("db/crm-data.sql")
                .build();
        executor = new JdbcReportQueryExecutor("crm", new JdbcTemplate(db), 5);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void bindsPositionalParametersInTextOrder() {
        CompiledQuery q = SelectBuilder.query()
                .select(SUBSCRIPTIONS.ID.ref())
                .from(SUBSCRIPTIONS)
                .where(in(SUBSCRIPTIONS.TRACKING_ID_4, List.of("111", "c")),
                       eq(SUBSCRIPTIONS.DELETED, 0),
                       withinDays(SUBSCRIPTIONS.DATE_CREATE, WEEK.start(), WEEK.end()))
                .orderBy(SUBSCRIPTIONS.ID, SortDirection.ASC)
                .build();

        List<Map<String, Object>> rows = executor.queryForRows(q);

        assertThat(rows).extracting(r -> ((Number) r.get("id")).longValue()).containsExactly(1L, 2L, 5L, 7L);
    }

    @Test
    void trackingRowsAggregateTrialsAndApprovals() {
        List<CrmTrackingRow> rows = executor.queryForRows(CrmAttributionQueries.trackingRows(WEEK, Map.of()))
                .stream().map(CrmTrackingRow::fromRow).toList();

        assertThat(rows).containsExactlyInAnyOrder(
                new CrmTrackingRow("google", "111", "as1", "ad1", 2, 1),
                new CrmTrackingRow("facebook", "", "", "", 1, 1),
                new CrmTrackingRow("newsletter", "c", "b", "a", 1, 1));
    }

    @Test
    void sourceAncestorMatchesEverySpelling() {
        List<CrmTrackingRow> rows = executor.queryForRows(
                        CrmAttributionQueries.trackingRows(WEEK, Map.of("utmSource", "google")))
                .stream().map(CrmTrackingRow::fromRow).toList();

        assertThat(rows).containsExactly(new CrmTrackingRow("google", "111", "as1", "ad1", 2, 1));
    }

    @Test
    void unknownCampaignAncestorMatchesMissingIds() {
        List<CrmTrackingRow> rows = executor.queryForRows(
                        CrmAttributionQueries.trackingRows(WEEK, Map.of("campaign", "Unknown")))
                .stream().map(CrmTrackingRow::fromRow).toList();

        assertThat(rows).extracting(CrmTrackingRow::source).containsExactly("facebook");
    }

    @Test
    void visitorRowsGroupByVisitor() {
        List<CrmVisitorRow> rows = executor.queryForRows(CrmAttributionQueries.visitorRows(WEEK, Map.of()))
                .stream().map(CrmVisitorRow::fromRow).toList();

        assertThat(rows).containsExactlyInAnyOrder(
                new CrmVisitorRow("v1", 2, 2),
                new CrmVisitorRow("v2", 1, 0));
    }

    @Test
    void dateAncestorNarrowsToOneDay() {
        List<CrmVisitorRow> rows = executor.queryForRows(
                        CrmAttributionQueries.visitorRows(WEEK, Map.of("date", "2024-01-03")))
                .stream().map(CrmVisitorRow::fromRow).toList();

        assertThat(rows).containsExactly(new CrmVisitorRow("v2", 1, 0));
    }

    @Test
    void driverErrorsSurfaceAsDataAccessException() {
        CompiledQuery q = SelectBuilder.query().select("missing_column").from(SUBSCRIPTIONS).build();

        assertThatThrownBy(() -> executor.queryForRows(q)).isInstanceOf(DataAccessException.class);
    }
}
