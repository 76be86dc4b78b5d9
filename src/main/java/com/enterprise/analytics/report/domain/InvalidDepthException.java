package com.enterprise.analytics.report.domain;

public class InvalidDepthException extends ReportQueryException {

    public InvalidDepthException(Integer depth, int dimensionCount) {
        super("Depth " + depth + " is outside [0, " + dimensionCount + ")");
    }
}
