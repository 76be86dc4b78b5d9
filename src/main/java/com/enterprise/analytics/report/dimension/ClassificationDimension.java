package com.enterprise.analytics.report.dimension;

import java.util.Objects;

/**
 * Dimension read from the classification join ({@code uc}/{@code ap} aliases).
 *
 * <p>{@code parentFilterExpression} is compared with the key a previous level
 * returned; {@code tableFilterExpression} (already lower-cased) with what a user
 * typed. {@code selectIdExpression} is null when the value is its own key.
 */
public record ClassificationDimension(
    String id,
    String selectIdExpression,
    String selectNameExpression,
    String groupByExpression,
    String parentFilterExpression,
    String tableFilterExpression
) implements DimensionDescriptor {

    public ClassificationDimension {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(selectNameExpression, "selectNameExpression");
        Objects.requireNonNull(groupByExpression, "groupByExpression");
        Objects.requireNonNull(parentFilterExpression, "parentFilterExpression");
        Objects.requireNonNull(tableFilterExpression, "tableFilterExpression");
    }

    public boolean hasIdColumn() {
        return selectIdExpression != null;
    }

    @Override
    public DimensionKind kind() {
        return DimensionKind.CLASSIFICATION;
    }

    @Override
    public DimensionLevel level() {
        return DimensionLevel.ENTRY;
    }
}
