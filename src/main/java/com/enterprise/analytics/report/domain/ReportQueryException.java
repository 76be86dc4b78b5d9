package com.enterprise.analytics.report.domain;

/**
 * Base of all input errors raised while compiling a report query. Always raised
 * before any SQL text is produced.
 */
public class ReportQueryException extends IllegalArgumentException {

    public ReportQueryException(String message) {
        super(message);
    }

    public ReportQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
