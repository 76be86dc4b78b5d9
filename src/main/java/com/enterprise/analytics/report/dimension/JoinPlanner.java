package com.enterprise.analytics.report.dimension;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Chooses the minimal-but-sufficient joins for a set of referenced dimensions:
 * the most specific spend join any enriched dimension asks for, plus the
 * classification join if any classification dimension appears.
 */
public class JoinPlanner {

    private final DimensionRegistry registry;

    public JoinPlanner(DimensionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public JoinPlan plan(String currentDimension,
                         Collection<String> ancestorFilterKeys,
                         Collection<String> userFilterFields) {
        Set<String> referenced = new LinkedHashSet<>();
        referenced.add(currentDimension);
        referenced.addAll(ancestorFilterKeys);
        referenced.addAll(userFilterFields);
        return plan(referenced);
    }

    public JoinPlan plan(Collection<String> dimensionIds) {
        JoinSpecificity level = null;
        boolean classification = false;
        for (String id : dimensionIds) {
            DimensionDescriptor d = registry.resolve(id);
            if (d instanceof EnrichedDimension e) {
                level = JoinSpecificity.mostSpecific(level, e.specificity());
            } else if (d instanceof ClassificationDimension) {
                classification = true;
            }
        }
        return new JoinPlan(level, classification, registry.table());
    }
}
