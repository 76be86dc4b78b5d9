package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.dimension.ColumnScope;
import com.enterprise.analytics.report.dimension.DimensionRegistries;
import com.enterprise.analytics.report.domain.DateRange;
import com.enterprise.analytics.report.domain.FilterOperator;
import com.enterprise.analytics.report.domain.TableFilter;
import com.enterprise.analytics.sql.condition.Condition;
import com.enterprise.analytics.sql.param.ParameterBinder;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.enterprise.analytics.report.domain.FilterOperator.*;
import static org.assertj.core.api.Assertions.*;

class TableFilterBuilderTest {

    private static final DateRange WEEK = DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7));
    private static final String CAMPAIGN_LOOKUP = "SELECT DISTINCT CAST(mas_f.campaign_id AS TEXT)"
            + " FROM merged_ads_spending mas_f"
            + " WHERE mas_f.date >= DATE '2024-01-01' AND mas_f.date < DATE '2024-01-08'"
            + " AND mas_f.campaign_id IS NOT NULL";

    private final TableFilterBuilder builder = new TableFilterBuilder(DimensionRegistries.PAGE_VIEW);
    private final ParameterBinder binder = new ParameterBinder();

    private String render(TableFilter... filters) {
        Condition c = builder.build(List.of(filters), ColumnScope.UNQUALIFIED, WEEK);
        return c == null ? null : c.toSql(binder);
    }

    private static TableFilter f(String field, FilterOperator op, String value) {
        return TableFilter.of(field, op, value);
    }

    @Test
    void enrichedEqualsMatchesIdOrDisplayName() {
        String sql = render(f("campaign", EQUALS, "Summer Sale"));

        assertThat(sql).isEqualTo("(LOWER(CAST(utm_campaign AS TEXT)) = :utm_campaign_1"
                + " OR CAST(utm_campaign AS TEXT) IN (" + CAMPAIGN_LOOKUP
                + " AND LOWER(mas_f.campaign_name) = :campaign_name_2))");
        assertThat(binder.getParameters())
                .containsEntry("utm_campaign_1", "summer sale")
                .containsEntry("campaign_name_2", "summer sale");
    }

    @Test
    void enrichedNotContainsKeepsNullsAndExcludesMatchingNames() {
        String sql = render(f("campaign", NOT_CONTAINS, "Promo"));

        assertThat(sql).isEqualTo("(utm_campaign IS NULL OR (LOWER(CAST(utm_campaign AS TEXT)) NOT LIKE :utm_campaign_1"
                + " AND CAST(utm_campaign AS TEXT) NOT IN (" + CAMPAIGN_LOOKUP
                + " AND LOWER(mas_f.campaign_name) LIKE :campaign_name_2)))");
        assertThat(binder.getParameters()).containsEntry("campaign_name_2", "%promo%");
    }

    @Test
    void plainNegationKeepsNullRows() {
        assertThat(render(f("country", NOT_EQUALS, "DE")))
                .isEqualTo("(country_code IS NULL OR LOWER(country_code) <> :country_code_1)");
        assertThat(binder.getParameters()).containsEntry("country_code_1", "de");
    }

    @Test
    void emptyOrUnknownEqualityMeansNull() {
        assertThat(render(f("country", EQUALS, ""))).isEqualTo("country_code IS NULL");
        assertThat(render(f("country", NOT_EQUALS, "Unknown"))).isEqualTo("country_code IS NOT NULL");
        assertThat(render(f("campaign", EQUALS, null))).isEqualTo("utm_campaign IS NULL");
    }

    @Test
    void emptyContainsIsDropped() {
        assertThat(render(f("country", CONTAINS, ""))).isNull();
        assertThat(render(f("country", CONTAINS, "  "), f("deviceType", EQUALS, "mobile")))
                .isEqualTo("LOWER(device_type) = :device_type_1");
    }

    @Test
    void sameFieldIsOredAndFieldsAreAnded() {
        String sql = render(
                f("country", EQUALS, "ES"),
                f("deviceType", CONTAINS, "mob"),
                f("country", EQUALS, "FR"));

        assertThat(sql).isEqualTo("((LOWER(country_code) = :country_code_1 OR LOWER(country_code) = :country_code_2)"
                + " AND LOWER(device_type) LIKE :device_type_3)");
    }

    @Test
    void classificationFiltersUseTheClassificationColumns() {
        assertThat(render(f("classifiedProduct", CONTAINS, "Cream")))
                .isEqualTo("LOWER(ap.name) LIKE :classifiedProduct_1");
        assertThat(render(f("classifiedProduct", EQUALS, "Unknown")))
                .isEqualTo("CAST(ap.id AS TEXT) IS NULL");
    }

    @Test
    void scopePrefixesEveryColumn() {
        Condition c = builder.build(List.of(f("adset", EQUALS, "x")), ColumnScope.single("pv."), WEEK);

        assertThat(c.toSql(binder))
                .startsWith("(LOWER(CAST(pv.utm_content AS TEXT)) = :utm_content_1 OR CAST(pv.utm_content AS TEXT) IN (")
                .contains("SELECT DISTINCT CAST(mas_f.adset_id AS TEXT)")
                .contains("LOWER(mas_f.adset_name) = :adset_name_2");
    }

    @Test
    void noFiltersYieldNoCondition() {
        assertThat(builder.build(List.of(), ColumnScope.UNQUALIFIED, WEEK)).isNull();
    }
}
