package com.enterprise.analytics.report.infrastructure;

import com.enterprise.analytics.report.application.AttributionQueryBuilder;
import com.enterprise.analytics.report.application.DrilldownQueryCompiler;
import com.enterprise.analytics.report.application.FlatQueryCompiler;
import com.enterprise.analytics.report.application.OnPageReportService;
import com.enterprise.analytics.report.dimension.DimensionRegistries;
import com.enterprise.analytics.report.dimension.DimensionRegistry;
import com.enterprise.analytics.shared.querybridge.adapter.JdbcReportQueryExecutor;
import com.enterprise.analytics.shared.querybridge.port.ReportQueryExecutor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.enterprise.analytics.report.domain.PageViewTable.PAGE_VIEWS;

@Configuration
public class ReportingConfig {

    // --- Dimension registries ---

    @Bean
    public DimensionRegistry pageViewRegistry() {
        return DimensionRegistries.PAGE_VIEW;
    }

    @Bean
    public DimensionRegistry sessionRegistry() {
        return DimensionRegistries.SESSION;
    }

    // --- Compilers ---

    @Bean
    public DrilldownQueryCompiler drilldownQueryCompiler(
            @Qualifier("pageViewRegistry") DimensionRegistry registry) {
        return new DrilldownQueryCompiler(registry);
    }

    @Bean
    public FlatQueryCompiler flatQueryCompiler(
            @Qualifier("sessionRegistry") DimensionRegistry registry) {
        return new FlatQueryCompiler(registry, PAGE_VIEWS);
    }

    @Bean
    public AttributionQueryBuilder attributionQueryBuilder(
            @Qualifier("pageViewRegistry") DimensionRegistry registry) {
        return new AttributionQueryBuilder(registry);
    }

    // --- Executors ---

    @Bean
    public ReportQueryExecutor analyticsExecutor(
            @Qualifier("analyticsJdbcTemplate") JdbcTemplate jdbc,
            @Value("${reporting.query-timeout-seconds:60}") int timeoutSeconds) {
        return new JdbcReportQueryExecutor("analytics", jdbc, timeoutSeconds);
    }

    @Bean
    public ReportQueryExecutor crmExecutor(
            @Qualifier("crmJdbcTemplate") JdbcTemplate jdbc,
            @Value("${reporting.query-timeout-seconds:60}") int timeoutSeconds) {
        return new JdbcReportQueryExecutor("crm", jdbc, timeoutSeconds);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService reportQueryPool(@Value("${reporting.executor-threads:8}") int threads) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("report-query-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(threads, factory);
    }

    // --- Service ---

    @Bean
    public OnPageReportService onPageReportService(
            DrilldownQueryCompiler compiler,
            AttributionQueryBuilder attribution,
            @Qualifier("analyticsExecutor") ReportQueryExecutor analytics,
            @Qualifier("crmExecutor") ReportQueryExecutor crm,
            @Qualifier("reportQueryPool") ExecutorService pool) {
        return new OnPageReportService(compiler, attribution, analytics, crm, pool);
    }
}
