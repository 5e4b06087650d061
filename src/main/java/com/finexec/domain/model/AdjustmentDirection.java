package com.finexec.domain.model;

import java.math.BigDecimal;

/**
 * Direction of a prior-year adjustment
 */
public enum AdjustmentDirection {
    INCREASE("increase"),
    DECREASE("decrease");

    private final String value;

    AdjustmentDirection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public BigDecimal signed(BigDecimal amount) {
        return this == INCREASE ? amount : amount.negate();
    }

    public static AdjustmentDirection fromValue(String value) {
        for (AdjustmentDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown adjustment direction: " + value);
    }
}
