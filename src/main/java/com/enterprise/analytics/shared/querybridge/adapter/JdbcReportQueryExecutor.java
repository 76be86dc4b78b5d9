package com.enterprise.analytics.shared.querybridge.adapter;

import com.enterprise.analytics.shared.querybridge.port.ReportQueryExecutor;
import com.enterprise.analytics.sql.builder.CompiledQuery;
import com.enterprise.analytics.sql.debug.QueryDebugger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ReportQueryExecutor} over a {@link JdbcTemplate}. Named parameters are
 * converted to positional {@code ?} placeholders via
 * {@link CompiledQuery#toPositional()} and bound with an
 * {@link ArgumentPreparedStatementSetter}.
 *
 * <p>One instance per engine:
 * <pre>{@code
 * @Bean
 * public ReportQueryExecutor crmExecutor(@Qualifier("crmJdbcTemplate") JdbcTemplate jdbc) {
 *     return new JdbcReportQueryExecutor("crm", jdbc, 30);
 * }
 * }</pre>
 */
public class JdbcReportQueryExecutor implements ReportQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcReportQueryExecutor.class);

    private final String name;
    private final JdbcTemplate jdbc;

    /**
     * @param name                engine name used in log lines
     * @param jdbc                template bound to the engine's DataSource
     * @param queryTimeoutSeconds per-statement timeout, 0 = driver default
     */
    public JdbcReportQueryExecutor(String name, JdbcTemplate jdbc, int queryTimeoutSeconds) {
        this.name = Objects.requireNonNull(name, "name");
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        if (queryTimeoutSeconds > 0) {
            this.jdbc.setQueryTimeout(queryTimeoutSeconds);
        }
    }

    @Override
    public List<Map<String, Object>> queryForRows(CompiledQuery query) {
        query.verify();
        CompiledQuery.PositionalQuery pq = query.toPositional();
        if (log.isDebugEnabled()) {
            log.debug("[{}] executing\n{}", name, QueryDebugger.format(query));
        }

        long started = System.nanoTime();
        List<Map<String, Object>> rows = jdbc.query(pq.sql(),
                new ArgumentPreparedStatementSetter(pq.valuesArray()),
                new ColumnMapRowMapper());
        log.debug("[{}] {} rows in {} ms", name, rows.size(), (System.nanoTime() - started) / 1_000_000);
        return rows;
    }
}
