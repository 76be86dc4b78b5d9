package com.enterprise.analytics.report.dimension;

import com.enterprise.analytics.sql.core.Column;

import java.util.Objects;

public record PlainDimension(
    String id,
    Column<?> column,
    ValueType valueType,
    DimensionLevel level
) implements DimensionDescriptor {

    public PlainDimension {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(valueType, "valueType");
        Objects.requireNonNull(level, "level");
    }

    public static PlainDimension text(String id, Column<?> column) {
        return new PlainDimension(id, column, ValueType.TEXT, DimensionLevel.ENTRY);
    }

    public static PlainDimension number(String id, Column<?> column) {
        return new PlainDimension(id, column, ValueType.NUMBER, DimensionLevel.ENTRY);
    }

    public static PlainDimension day(String id, Column<?> column) {
        return new PlainDimension(id, column, ValueType.DATE, DimensionLevel.ENTRY);
    }

    public static PlainDimension url(String id, Column<?> column) {
        return new PlainDimension(id, column, ValueType.URL, DimensionLevel.ENTRY);
    }

    public static PlainDimension eventUrl(String id, Column<?> column) {
        return new PlainDimension(id, column, ValueType.URL, DimensionLevel.EVENT);
    }

    @Override
    public DimensionKind kind() {
        return DimensionKind.PLAIN;
    }
}
