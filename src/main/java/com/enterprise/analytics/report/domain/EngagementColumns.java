package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.Column;

public record EngagementColumns(
    Column<Integer> activeTimeSeconds,
    Column<Boolean> heroScrollPassed,
    Column<Boolean> formView,
    Column<Boolean> formStarted
) {}
