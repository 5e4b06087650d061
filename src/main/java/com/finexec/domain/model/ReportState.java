package com.finexec.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Authoritative value map of a report draft, keyed by activity code.
 * Immutable: updates return a new state.
 */
public final class ReportState {

    private static final ReportState EMPTY = new ReportState(Collections.emptyMap());

    private final Map<String, ActivityValue> values;

    private ReportState(Map<String, ActivityValue> values) {
        this.values = values;
    }

    public static ReportState empty() {
        return EMPTY;
    }

    public static ReportState of(Map<String, ActivityValue> values) {
        return new ReportState(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public ActivityValue value(String code) {
        return values.getOrDefault(code, ActivityValue.EMPTY);
    }

    public BigDecimal amount(String code, Quarter quarter) {
        return value(code).getAmounts().get(quarter);
    }

    public boolean contains(String code) {
        return values.containsKey(code);
    }

    public ReportState with(String code, ActivityValue value) {
        Map<String, ActivityValue> copy = new LinkedHashMap<>(values);
        copy.put(code, value);
        return new ReportState(Collections.unmodifiableMap(copy));
    }

    public ReportState update(String code, UnaryOperator<ActivityValue> change) {
        return with(code, change.apply(value(code)));
    }

    public Map<String, ActivityValue> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReportState && values.equals(((ReportState) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }
}
