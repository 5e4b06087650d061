package com.finexec.domain.model;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Aggregated quarterly values of a row plus its cumulative balance
 */
public final class QuarterlyTotals {

    private static final QuarterlyTotals ZERO = new QuarterlyTotals(
            new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO},
            EnumSet.noneOf(Quarter.class), BigDecimal.ZERO);

    private final BigDecimal[] values;
    private final Set<Quarter> reported;
    private final BigDecimal cumulativeBalance;

    private QuarterlyTotals(BigDecimal[] values, Set<Quarter> reported, BigDecimal cumulativeBalance) {
        this.values = values;
        this.reported = Collections.unmodifiableSet(reported.isEmpty()
                ? EnumSet.noneOf(Quarter.class) : EnumSet.copyOf(reported));
        this.cumulativeBalance = cumulativeBalance;
    }

    public static QuarterlyTotals zero() {
        return ZERO;
    }

    /**
     * Totals whose cumulative balance follows the given aggregation rule
     */
    public static QuarterlyTotals of(BigDecimal[] values, Set<Quarter> reported, AggregationRule rule) {
        BigDecimal[] copy = values.clone();
        return new QuarterlyTotals(copy, reported, rule.cumulative(copy, reported));
    }

    /**
     * Totals with an explicitly supplied cumulative balance
     */
    public static QuarterlyTotals withCumulative(BigDecimal[] values, Set<Quarter> reported, BigDecimal cumulative) {
        return new QuarterlyTotals(values.clone(), reported, cumulative);
    }

    public BigDecimal get(Quarter quarter) {
        return values[quarter.index()];
    }

    public BigDecimal getQ1() {
        return values[0];
    }

    public BigDecimal getQ2() {
        return values[1];
    }

    public BigDecimal getQ3() {
        return values[2];
    }

    public BigDecimal getQ4() {
        return values[3];
    }

    public BigDecimal getCumulativeBalance() {
        return cumulativeBalance;
    }

    public Set<Quarter> getReported() {
        return reported;
    }

    public BigDecimal[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QuarterlyTotals)) {
            return false;
        }
        QuarterlyTotals other = (QuarterlyTotals) o;
        return Arrays.equals(values, other.values)
                && reported.equals(other.reported)
                && cumulativeBalance.equals(other.cumulativeBalance);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + cumulativeBalance.hashCode();
    }

    @Override
    public String toString() {
        return "QuarterlyTotals{q=" + Arrays.toString(values) + ", cumulative=" + cumulativeBalance + "}";
    }
}
