package com.finexec.domain.service;

/**
 * Raised when a user action cannot be applied to a report draft
 */
public class InvalidReportActionException extends IllegalArgumentException {

    public InvalidReportActionException(String message) {
        super(message);
    }
}
