package com.finexec.domain.model;

import java.util.Optional;

/**
 * Fiscal quarter of a reporting year
 */
public enum Quarter {
    Q1("Q1"),
    Q2("Q2"),
    Q3("Q3"),
    Q4("Q4");

    private final String value;

    Quarter(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Lower-case key used by quarter-keyed JSON maps ("q1".."q4")
     */
    public String key() {
        return value.toLowerCase();
    }

    public int index() {
        return ordinal();
    }

    public Optional<Quarter> previous() {
        return this == Q1 ? Optional.empty() : Optional.of(values()[ordinal() - 1]);
    }

    public boolean isAfter(Quarter other) {
        return ordinal() > other.ordinal();
    }

    public static Quarter fromValue(String value) {
        for (Quarter quarter : values()) {
            if (quarter.value.equalsIgnoreCase(value)) {
                return quarter;
            }
        }
        throw new IllegalArgumentException("Unknown quarter: " + value);
    }

    public static boolean isValid(String value) {
        for (Quarter quarter : values()) {
            if (quarter.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
