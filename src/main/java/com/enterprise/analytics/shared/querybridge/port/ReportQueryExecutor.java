package com.enterprise.analytics.shared.querybridge.port;

import com.enterprise.analytics.sql.builder.CompiledQuery;

import java.util.List;
import java.util.Map;

/**
 * Runs a compiled report query against one storage engine.
 *
 * <p>Rows are column-label keyed maps. Implementations surface failures as
 * Spring's {@link org.springframework.dao.DataAccessException}; callers decide
 * whether a failed source degrades or fails the request.
 */
@FunctionalInterface
public interface ReportQueryExecutor {

    List<Map<String, Object>> queryForRows(CompiledQuery query);
}
