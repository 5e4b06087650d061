package com.finexec.application.service;

/**
 * Whether a validation finding blocks submission
 */
public enum Severity {
    ERROR("error"),
    WARNING("warning");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
