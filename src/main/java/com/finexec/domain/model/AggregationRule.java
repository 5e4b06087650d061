package com.finexec.domain.model;

import java.math.BigDecimal;
import java.util.Set;

/**
 * How a row's cumulative balance is derived from its quarterly values
 */
public enum AggregationRule {
    /** Sum over the reporting period. */
    FLOW,
    /** Point-in-time position: value of the latest reported quarter. */
    STOCK;

    public BigDecimal cumulative(BigDecimal[] quarterValues, Set<Quarter> reported) {
        if (this == FLOW) {
            BigDecimal sum = BigDecimal.ZERO;
            for (BigDecimal value : quarterValues) {
                sum = sum.add(value);
            }
            return sum;
        }
        for (int i = Quarter.values().length - 1; i >= 0; i--) {
            if (reported.contains(Quarter.values()[i])) {
                return quarterValues[i];
            }
        }
        return BigDecimal.ZERO;
    }
}
