package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.SortDirection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable report request.
 *
 * <p>{@code depth} is set for depth-recursive queries and {@code null} for flat
 * ones. {@code ancestorFilters} keeps insertion order so that compiling the same
 * request twice yields the same text. {@code limit} may be null (default applies).
 */
public record QueryRequest(
    DateRange dateRange,
    List<String> dimensions,
    Integer depth,
    Map<String, String> ancestorFilters,
    List<TableFilter> userFilters,
    String sortBy,
    SortDirection sortDirection,
    Integer limit
) {

    public static final String UNKNOWN = "Unknown";

    public QueryRequest {
        Objects.requireNonNull(dateRange, "dateRange");
        dimensions = List.copyOf(Objects.requireNonNull(dimensions, "dimensions"));
        ancestorFilters = ancestorFilters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(ancestorFilters));
        userFilters = userFilters == null ? List.of() : List.copyOf(userFilters);
        sortDirection = sortDirection == null ? SortDirection.DESC : sortDirection;
    }

    public boolean isFlat() {
        return depth == null;
    }

    /** The dimension grouped by at {@link #depth()}. */
    public String currentDimension() {
        if (depth == null || depth < 0 || depth >= dimensions.size()) {
            throw new InvalidDepthException(depth, dimensions.size());
        }
        return dimensions.get(depth);
    }

    public List<String> userFilterFields() {
        return userFilters.stream().map(TableFilter::field).distinct().toList();
    }

    public static Builder builder(DateRange dateRange) {
        return new Builder(dateRange);
    }

    public static final class Builder {
        private final DateRange dateRange;
        private final List<String> dimensions = new ArrayList<>();
        private Integer depth;
        private final Map<String, String> ancestorFilters = new LinkedHashMap<>();
        private final List<TableFilter> userFilters = new ArrayList<>();
        private String sortBy;
        private SortDirection sortDirection;
        private Integer limit;

        private Builder(DateRange dateRange) {
            this.dateRange = dateRange;
        }

        public Builder dimensions(String... ids) {
            dimensions.clear();
            dimensions.addAll(List.of(ids));
            return this;
        }

        public Builder depth(Integer depth) {
            this.depth = depth;
            return this;
        }

        public Builder ancestor(String dimensionId, String value) {
            ancestorFilters.put(dimensionId, value);
            return this;
        }

        public Builder filter(String field, FilterOperator operator, String value) {
            userFilters.add(TableFilter.of(field, operator, value));
            return this;
        }

        public Builder sortBy(String metricId, SortDirection direction) {
            this.sortBy = metricId;
            this.sortDirection = direction;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(dateRange, dimensions, depth, ancestorFilters,
                    userFilters, sortBy, sortDirection, limit);
        }
    }
}
