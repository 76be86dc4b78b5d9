package com.enterprise.analytics.report.domain;

public class MalformedAncestorFiltersException extends ReportQueryException {

    public MalformedAncestorFiltersException(String message) {
        super(message);
    }
}
