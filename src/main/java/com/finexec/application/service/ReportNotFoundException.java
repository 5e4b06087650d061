package com.finexec.application.service;

/**
 * No draft exists for the requested report id
 */
public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(String reportId) {
        super("Report not found: " + reportId);
    }
}
