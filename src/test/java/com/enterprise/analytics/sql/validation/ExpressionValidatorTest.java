package com.enterprise.analytics.sql.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class ExpressionValidatorTest {

    @Test
    void acceptsQualifiedIdentifiers() {
        assertThatCode(() -> ExpressionValidator.validateIdentifier("pv.utm_campaign"))
                .doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"1abc", "a b", "x;y", ""})
    void rejectsMalformedIdentifiers(String identifier) {
        assertThatThrownBy(() -> ExpressionValidator.validateIdentifier(identifier))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acceptsReportExpressions() {
        assertThatCode(() -> ExpressionValidator.validateExpression(
                "COALESCE(NULLIF(MAX(mas.campaign_name), ''), 'Unknown')"))
                .doesNotThrowAnyException();
        assertThatCode(() -> ExpressionValidator.validateExpression(
                "REGEXP_REPLACE(pv.url_path, '^[a-z]+://', '')"))
                .doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "1 = 1; DROP TABLE subscription",
            "x -- comment",
            "x /* hidden */",
            "delete from invoice"
    })
    void rejectsInjectedExpressions(String expression) {
        assertThatThrownBy(() -> ExpressionValidator.validateExpression(expression))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void keywordInsideIdentifierIsAllowed() {
        assertThatCode(() -> ExpressionValidator.validateExpression("s.date_create"))
                .doesNotThrowAnyException();
    }
}
