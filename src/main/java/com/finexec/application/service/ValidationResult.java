package com.finexec.application.service;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of validating a report; valid when no finding is blocking
 */
public record ValidationResult(boolean isValid, List<ValidationIssue> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<ValidationIssue> blocking() {
        return errors.stream().filter(ValidationIssue::isBlocking).collect(Collectors.toList());
    }

    public List<ValidationIssue> warnings() {
        return errors.stream().filter(issue -> !issue.isBlocking()).collect(Collectors.toList());
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, Collections.emptyList());
    }

    public static ValidationResult of(List<ValidationIssue> issues) {
        boolean valid = issues.stream().noneMatch(ValidationIssue::isBlocking);
        return new ValidationResult(valid, Collections.unmodifiableList(issues));
    }
}
