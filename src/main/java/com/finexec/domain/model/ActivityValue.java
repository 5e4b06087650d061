package com.finexec.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Per-activity values of one report draft
 * Quarter-keyed ledgers default to empty so formulas never see a missing sub-map
 */
@Value
@Builder(toBuilder = true)
public class ActivityValue {

    public static final ActivityValue EMPTY = ActivityValue.builder().build();

    @Builder.Default
    QuarterAmounts amounts = QuarterAmounts.empty();
    String comment;

    // Expense lines
    @Builder.Default
    QuarterStatuses paymentStatus = QuarterStatuses.empty();
    @Builder.Default
    QuarterAmounts amountPaid = QuarterAmounts.empty();

    // VAT-applicable expenses (and VAT receivable lines for vatCleared)
    @Builder.Default
    QuarterAmounts netAmount = QuarterAmounts.empty();
    @Builder.Default
    QuarterAmounts vatAmount = QuarterAmounts.empty();
    @Builder.Default
    QuarterAmounts vatCleared = QuarterAmounts.empty();

    // Liability / asset lines
    @Builder.Default
    QuarterAmounts payableCleared = QuarterAmounts.empty();
    @Builder.Default
    QuarterAmounts otherReceivableCleared = QuarterAmounts.empty();
    @Builder.Default
    QuarterAmounts priorYearAdjustment = QuarterAmounts.empty();

    public ActivityValue withAmount(Quarter quarter, BigDecimal amount) {
        return toBuilder().amounts(amounts.with(quarter, amount)).build();
    }
}
