package com.enterprise.analytics.report.dimension;

/**
 * How a dimension id resolves to SQL. Compilers never branch on the id itself;
 * they hand the descriptor to {@link DimensionRenderer}.
 */
public sealed interface DimensionDescriptor
        permits PlainDimension, EnrichedDimension, ClassificationDimension {

    String id();

    DimensionKind kind();

    DimensionLevel level();
}
