package com.finexec.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Report draft of one facility, program and quarter
 * Entity - identified by reportId
 */
@Value
@Builder(toBuilder = true)
public class ReportDraft {
    String reportId;
    String programType;
    String facilityType;
    String facilityId;
    int fiscalYear;
    Quarter quarter;
    ActivityTree tree;
    PreviousQuarterBalances previous;
    BigDecimal plannedBudget;  // nullable
    ReportState state;
}
