package com.enterprise.analytics.report.domain;

public class UnknownDimensionException extends ReportQueryException {

    private final String dimensionId;

    public UnknownDimensionException(String dimensionId) {
        super("Unknown dimension: " + dimensionId);
        this.dimensionId = dimensionId;
    }

    public UnknownDimensionException(String dimensionId, String reason) {
        super("Unsupported dimension " + dimensionId + ": " + reason);
        this.dimensionId = dimensionId;
    }

    public String dimensionId() {
        return dimensionId;
    }
}
