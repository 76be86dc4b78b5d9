package com.enterprise.analytics.report.dimension;

import com.enterprise.analytics.report.domain.EventTable;
import com.enterprise.analytics.report.domain.UnknownDimensionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed mapping from dimension id to its {@link DimensionDescriptor} for one
 * event table. Built once at start-up, read-only afterwards.
 */
public class DimensionRegistry {

    private final EventTable table;
    private final Map<String, DimensionDescriptor> descriptors;

    public DimensionRegistry(EventTable table, List<DimensionDescriptor> descriptors) {
        this.table = Objects.requireNonNull(table, "table");
        Map<String, DimensionDescriptor> byId = new LinkedHashMap<>();
        for (DimensionDescriptor d : descriptors) {
            if (byId.putIfAbsent(d.id(), d) != null) {
                throw new IllegalStateException("Duplicate dimension id: " + d.id());
            }
        }
        this.descriptors = Collections.unmodifiableMap(byId);
    }

    /**
     * @throws UnknownDimensionException if the id is not registered
     */
    public DimensionDescriptor resolve(String dimensionId) {
        DimensionDescriptor d = descriptors.get(dimensionId);
        if (d == null) {
            throw new UnknownDimensionException(dimensionId);
        }
        return d;
    }

    public boolean contains(String dimensionId) {
        return descriptors.containsKey(dimensionId);
    }

    public Set<String> ids() {
        return descriptors.keySet();
    }

    /** The event table the descriptors read from, unaliased. */
    public EventTable table() {
        return table;
    }
}
