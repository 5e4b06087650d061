package com.finexec.domain.model;

/**
 * Statement sections of an execution report
 */
public enum Section {
    A("A", "Receipts", AggregationRule.FLOW, false),
    B("B", "Expenditures", AggregationRule.FLOW, false),
    C("C", "Surplus / Deficit", AggregationRule.FLOW, true),
    D("D", "Financial Assets", AggregationRule.STOCK, false),
    E("E", "Financial Liabilities", AggregationRule.STOCK, false),
    F("F", "Net Financial Assets", AggregationRule.STOCK, true),
    G("G", "Closing Balance", AggregationRule.FLOW, false),
    X("X", "Miscellaneous Adjustments", AggregationRule.FLOW, false);

    private final String value;
    private final String label;
    private final AggregationRule aggregationRule;
    private final boolean derived;

    Section(String value, String label, AggregationRule aggregationRule, boolean derived) {
        this.value = value;
        this.label = label;
        this.aggregationRule = aggregationRule;
        this.derived = derived;
    }

    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public AggregationRule getAggregationRule() {
        return aggregationRule;
    }

    /**
     * Sections whose values are produced by the derived section engine instead of line items
     */
    public boolean isDerived() {
        return derived;
    }

    /**
     * Sections whose amounts must never be negative
     */
    public boolean isNonNegative() {
        return this == A || this == B || this == D || this == E || this == X;
    }

    public static Section fromValue(String value) {
        for (Section section : values()) {
            if (section.value.equalsIgnoreCase(value)) {
                return section;
            }
        }
        throw new IllegalArgumentException("Unknown section: " + value);
    }

    public static boolean isValid(String value) {
        for (Section section : values()) {
            if (section.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
