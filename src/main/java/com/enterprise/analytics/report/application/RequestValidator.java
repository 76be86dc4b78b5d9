package com.enterprise.analytics.report.application;

import com.enterprise.analytics.report.dimension.DimensionRegistry;
import com.enterprise.analytics.report.domain.InvalidDepthException;
import com.enterprise.analytics.report.domain.MalformedAncestorFiltersException;
import com.enterprise.analytics.report.domain.QueryRequest;
import com.enterprise.analytics.report.domain.ReportQueryException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Input checks shared by the compilers. Runs before any SQL is produced.
 */
final class RequestValidator {

    private RequestValidator() {}

    /**
     * Depth-recursive request: depth in range, every id registered, ancestor keys
     * forming a prefix of the dimensions above {@code depth}, and no field used
     * both as ancestor filter and user filter.
     */
    static void validateDrilldown(QueryRequest request, DimensionRegistry registry) {
        Integer depth = request.depth();
        int size = request.dimensions().size();
        if (depth == null || depth < 0 || depth >= size) {
            throw new InvalidDepthException(depth, size);
        }
        validateIds(request, registry);

        Set<String> keys = request.ancestorFilters().keySet();
        if (keys.size() > depth) {
            throw new MalformedAncestorFiltersException("Expected at most " + depth
                    + " ancestor filters at depth " + depth + " but got " + keys);
        }
        // insertion order of the ancestor map is the drill path
        List<String> expected = request.dimensions().subList(0, keys.size());
        if (!expected.equals(new ArrayList<>(keys))) {
            throw new MalformedAncestorFiltersException("Ancestor filters " + keys
                    + " are not a prefix of dimensions " + request.dimensions());
        }
        validateNoOverlap(request);
    }

    /** Flat request: at least one dimension, every id registered, no ancestor filters. */
    static void validateFlat(QueryRequest request, DimensionRegistry registry) {
        if (request.dimensions().isEmpty()) {
            throw new ReportQueryException("Flat query needs at least one dimension");
        }
        validateIds(request, registry);
        if (!request.ancestorFilters().isEmpty()) {
            throw new MalformedAncestorFiltersException(
                    "Flat queries group by every dimension and take no ancestor filters");
        }
    }

    private static void validateIds(QueryRequest request, DimensionRegistry registry) {
        List<String> dims = request.dimensions();
        if (new HashSet<>(dims).size() != dims.size()) {
            throw new ReportQueryException("Duplicate dimensions in " + dims);
        }
        dims.forEach(registry::resolve);
        request.ancestorFilters().keySet().forEach(registry::resolve);
        request.userFilterFields().forEach(registry::resolve);
    }

    private static void validateNoOverlap(QueryRequest request) {
        for (String field : request.userFilterFields()) {
            if (request.ancestorFilters().containsKey(field)) {
                throw new MalformedAncestorFiltersException(
                        "Field " + field + " is used both as ancestor filter and user filter");
            }
        }
    }
}
