package com.finexec.domain.model;

/**
 * Snapshot sent for verification after edits settle
 */
public record BalanceVerificationRequest(
        String reportId,
        Quarter quarter,
        ReportState state,
        ComputedValues computedValues
) {}
