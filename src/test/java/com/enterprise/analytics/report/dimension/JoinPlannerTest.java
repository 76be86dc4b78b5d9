package com.enterprise.analytics.report.dimension;

import com.enterprise.analytics.report.domain.DateRange;
import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.builder.SelectBuilder;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JoinPlannerTest {

    private final JoinPlanner planner = new JoinPlanner(DimensionRegistries.PAGE_VIEW);
    private final DateRange range = DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7));

    @Test
    void plainDimensionsNeedNoJoin() {
        JoinPlan plan = planner.plan("country", List.of(), List.of("deviceType"));

        assertThat(plan.needsJoin()).isFalse();
        assertThat(plan.columnPrefix()).isEmpty();
        assertThat(plan.source().isAliased()).isFalse();
    }

    @Test
    void mostSpecificEnrichedLevelWins() {
        assertThat(planner.plan("campaign", List.of(), List.of()).enrichedJoinLevel())
                .isEqualTo(JoinSpecificity.CAMPAIGN);
        assertThat(planner.plan("campaign", List.of(), List.of("ad")).enrichedJoinLevel())
                .isEqualTo(JoinSpecificity.AD);
        assertThat(planner.plan("country", List.of("adset"), List.of()).enrichedJoinLevel())
                .isEqualTo(JoinSpecificity.AD_SET);
    }

    @Test
    void classificationFlagIsIndependentOfSpendJoin() {
        JoinPlan plan = planner.plan("classifiedProduct", List.of("campaign"), List.of());

        assertThat(plan.needsClassificationJoin()).isTrue();
        assertThat(plan.hasEnrichedJoin()).isTrue();
        assertThat(plan.columnPrefix()).isEqualTo("pv.");
    }

    @Test
    void campaignJoinCarriesOnlyCampaignKeys() {
        String sql = render(planner.plan("campaign", List.of(), List.of()));

        assertThat(sql).contains("SELECT campaign_id, MAX(campaign_name) AS campaign_name FROM merged_ads_spending");
        assertThat(sql).contains("GROUP BY campaign_id) mas ON CAST(pv.utm_campaign AS TEXT) = CAST(mas.campaign_id AS TEXT)");
        assertThat(sql).doesNotContain("adset_id").doesNotContain("ad_id");
    }

    @Test
    void adJoinCarriesEveryBroaderKey() {
        String sql = render(planner.plan("country", List.of(), List.of("ad")));

        assertThat(sql).contains("campaign_id", "adset_id", "ad_id", "MAX(ad_name) AS ad_name");
        assertThat(sql).contains("CAST(pv.utm_campaign AS TEXT) = CAST(mas.campaign_id AS TEXT)"
                + " AND CAST(pv.utm_content AS TEXT) = CAST(mas.adset_id AS TEXT)"
                + " AND CAST(pv.utm_medium AS TEXT) = CAST(mas.ad_id AS TEXT)");
    }

    @Test
    void spendJoinIsRestrictedToTheDateRange() {
        String sql = render(planner.plan("campaign", List.of(), List.of()));
        assertThat(sql).contains("WHERE date >= DATE '2024-01-01' AND date < DATE '2024-01-08'");
    }

    @Test
    void classificationJoinExcludesIgnoredUrls() {
        String sql = render(planner.plan("classifiedCountry", List.of(), List.of()));

        assertThat(sql).contains(
                "LEFT JOIN app_url_classifications uc ON pv.url_path = uc.url_path AND uc.is_ignored = false"
                + " LEFT JOIN app_products ap ON uc.product_id = ap.id");
    }

    private String render(JoinPlan plan) {
        SelectBuilder query = SelectBuilder.query().select("1").from(plan.source());
        plan.applyJoins(query, range);
        CompiledQuery q = query.build();
        return q.sql();
    }
}
