package com.finexec.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Derived per-section totals, recomputed on every change and never persisted
 */
@Value
@Builder
public class ComputedValues {
    QuarterlyTotals receipts;
    QuarterlyTotals expenditures;
    QuarterlyTotals surplus;
    QuarterlyTotals financialAssets;
    QuarterlyTotals financialLiabilities;
    QuarterlyTotals netFinancialAssets;
    QuarterlyTotals closingBalance;
}
