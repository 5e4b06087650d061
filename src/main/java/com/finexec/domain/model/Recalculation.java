package com.finexec.domain.model;

import java.util.List;

/**
 * Output of one full recomputation pass over a report draft
 */
public record Recalculation(
        ReportState state,
        BalanceSnapshot balances,
        ComputedValues computedValues,
        List<StatementRow> table
) {}
