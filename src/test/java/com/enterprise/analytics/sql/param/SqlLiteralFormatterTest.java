package com.enterprise.analytics.sql.param;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class SqlLiteralFormatterTest {

    @Test
    void string() {
        assertThat(SqlLiteralFormatter.format("Unknown")).isEqualTo("'Unknown'");
    }

    @Test
    void stringWithQuotes() {
        assertThat(SqlLiteralFormatter.format("it's")).isEqualTo("'it''s'");
    }

    @Test
    void integerValue() {
        assertThat(SqlLiteralFormatter.format(7)).isEqualTo("7");
    }

    @Test
    void bigDecimalScientific() {
        // 1E+3 should render as 1000, not scientific notation
        assertThat(SqlLiteralFormatter.format(new BigDecimal("1E+3"))).isEqualTo("1000");
    }

    @Test
    void booleansAreSqlKeywords() {
        assertThat(SqlLiteralFormatter.format(true)).isEqualTo("TRUE");
        assertThat(SqlLiteralFormatter.format(false)).isEqualTo("FALSE");
    }

    @Test
    void localDate() {
        assertThat(SqlLiteralFormatter.format(LocalDate.of(2024, 3, 15)))
                .isEqualTo("DATE '2024-03-15'");
    }

    @Test
    void nullThrows() {
        assertThatThrownBy(() -> SqlLiteralFormatter.format(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void unsupportedTypeThrows() {
        assertThatThrownBy(() -> SqlLiteralFormatter.format(new Object()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported literal type");
    }
}
