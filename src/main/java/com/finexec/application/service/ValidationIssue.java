package com.finexec.application.service;

/**
 * Single validation finding attached to a field (activity code or named check)
 */
public record ValidationIssue(String field, String message, Severity severity) {

    public static ValidationIssue error(String field, String message) {
        return new ValidationIssue(field, message, Severity.ERROR);
    }

    public static ValidationIssue warning(String field, String message) {
        return new ValidationIssue(field, message, Severity.WARNING);
    }

    public boolean isBlocking() {
        return severity == Severity.ERROR;
    }
}
