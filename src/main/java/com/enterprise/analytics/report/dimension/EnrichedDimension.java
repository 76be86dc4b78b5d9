package com.enterprise.analytics.report.dimension;

import com.enterprise.analytics.sql.core.Column;

import java.util.Objects;

/**
 * Raw tracking id on the event table plus a display name resolved through the
 * spend join at {@link #specificity()}.
 */
public record EnrichedDimension(
    String id,
    JoinSpecificity specificity,
    Column<?> rawColumn
) implements DimensionDescriptor {

    public EnrichedDimension {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(specificity, "specificity");
        Objects.requireNonNull(rawColumn, "rawColumn");
    }

    @Override
    public DimensionKind kind() {
        return DimensionKind.ENRICHED;
    }

    @Override
    public DimensionLevel level() {
        return DimensionLevel.ENTRY;
    }
}
