package com.enterprise.analytics.sql.condition;

import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.param.ParameterBinder;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.enterprise.analytics.report.domain.PageViewTable.PAGE_VIEWS;
import static com.enterprise.analytics.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.*;

class ConditionsTest {

    private final ParameterBinder binder = new ParameterBinder();

    @Test
    void equalityBindsValue() {
        assertThat(eq(PAGE_VIEWS.COUNTRY_CODE, "ES").toSql(binder))
                .isEqualTo("pv.country_code = :country_code_1");
        assertThat(binder.getParameters()).containsEntry("country_code_1", "ES");
    }

    @Test
    void nullValueIsRejected() {
        assertThatThrownBy(() -> eq(PAGE_VIEWS.COUNTRY_CODE, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("isNull");
    }

    @Test
    void containsWrapsInWildcards() {
        assertThat(contains(PAGE_VIEWS.URL_PATH.lower(), "promo").toSql(binder))
                .isEqualTo("LOWER(pv.url_path) LIKE :url_path_1");
        assertThat(binder.getParameters()).containsEntry("url_path_1", "%promo%");
    }

    @Test
    void inListBindsEachValue() {
        assertThat(in(PAGE_VIEWS.UTM_SOURCE, List.of("google", "adwords")).toSql(binder))
                .isEqualTo("pv.utm_source IN (:utm_source_1, :utm_source_2)");
    }

    @Test
    void emptyInListIsRejected() {
        assertThatThrownBy(() -> in(PAGE_VIEWS.UTM_SOURCE, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dayRangeIsHalfOpenWithInlinedDates() {
        String sql = withinDays(PAGE_VIEWS.CREATED_AT, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31))
                .toSql(binder);

        assertThat(sql).isEqualTo(
                "pv.created_at >= DATE '2024-01-01' AND pv.created_at < DATE '2024-02-01'");
        assertThat(binder.getParameters()).isEmpty();
    }

    @Test
    void booleanConstantsAreInlined() {
        assertThat(isFalse(PAGE_VIEWS.FORM_VIEW).toSql(binder)).isEqualTo("pv.form_view = false");
    }

    @Test
    void compositesAreParenthesized() {
        Condition c = or(isNull(PAGE_VIEWS.UTM_CAMPAIGN), and(neq(PAGE_VIEWS.UTM_CAMPAIGN, "x"), isNotNull(PAGE_VIEWS.UTM_MEDIUM)));
        assertThat(c.toSql(binder)).isEqualTo(
                "(pv.utm_campaign IS NULL OR (pv.utm_campaign <> :utm_campaign_1 AND pv.utm_medium IS NOT NULL))");
    }

    @Test
    void singleChildCompositeCollapses() {
        assertThat(and(isNull(PAGE_VIEWS.UTM_SOURCE), null).toSql(binder))
                .isEqualTo("pv.utm_source IS NULL");
    }

    @Test
    void ifAnyVariantsReturnNullWhenEmpty() {
        assertThat(andIfAny(Arrays.asList(null, null))).isNull();
        assertThat(orIfAny(List.of())).isNull();
        assertThatThrownBy(() -> and(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void eqIfPresentSkipsNull() {
        assertThat(eqIfPresent(PAGE_VIEWS.UTM_SOURCE, null)).isNull();
        assertThat(inIfPresent(PAGE_VIEWS.UTM_SOURCE, List.of())).isNull();
    }

    @Test
    void subqueryConditionEmbedsText() {
        CompiledQuery sub = new CompiledQuery("SELECT id FROM t WHERE n = :n_9", Map.of("n_9", "a"));
        assertThat(notInSubquery(PAGE_VIEWS.UTM_CAMPAIGN.castText(), sub).toSql(binder))
                .isEqualTo("CAST(pv.utm_campaign AS TEXT) NOT IN (SELECT id FROM t WHERE n = :n_9)");
    }

    @Test
    void rawConditionChecksPlaceholderCount() {
        assertThat(raw("pv.visit_number > ?", 1).toSql(binder)).isEqualTo("pv.visit_number > :raw_1");
        assertThatThrownBy(() -> raw("a = ? AND b = ?", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> raw("1 = 1; DROP TABLE x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
