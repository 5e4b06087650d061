package com.finexec.domain.model;

import java.util.List;

/**
 * Computed section totals together with the nested statement table
 */
public record StatementProjection(ComputedValues computedValues, List<StatementRow> rows) {}
