package com.finexec.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Row of the read-only statement table projection
 */
@Value
@Builder(toBuilder = true)
public class StatementRow {
    String id;
    String title;
    RowKind kind;
    boolean editable;
    boolean calculated;
    QuarterlyTotals totals;
    @Singular("child")
    List<StatementRow> children;
}
