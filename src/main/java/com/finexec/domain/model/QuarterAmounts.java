package com.finexec.domain.model;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Objects;

/**
 * Four quarterly amount slots indexed by {@link Quarter}.
 * A {@code null} slot means "not yet reported", which is distinct from a reported zero.
 * Immutable: every mutator returns a new instance.
 */
public final class QuarterAmounts {

    private static final QuarterAmounts EMPTY = new QuarterAmounts(new BigDecimal[4]);

    private final BigDecimal[] slots;

    private QuarterAmounts(BigDecimal[] slots) {
        this.slots = slots;
    }

    public static QuarterAmounts empty() {
        return EMPTY;
    }

    public static QuarterAmounts of(BigDecimal q1, BigDecimal q2, BigDecimal q3, BigDecimal q4) {
        return new QuarterAmounts(new BigDecimal[]{q1, q2, q3, q4});
    }

    public static QuarterAmounts single(Quarter quarter, BigDecimal amount) {
        return EMPTY.with(quarter, amount);
    }

    /**
     * Amount reported for the quarter, zero when not reported
     */
    public BigDecimal get(Quarter quarter) {
        BigDecimal value = slots[quarter.index()];
        return value == null ? BigDecimal.ZERO : value;
    }

    /**
     * Raw slot, {@code null} when the quarter was never reported
     */
    public BigDecimal rawValue(Quarter quarter) {
        return slots[quarter.index()];
    }

    public boolean isReported(Quarter quarter) {
        return slots[quarter.index()] != null;
    }

    public boolean isEmpty() {
        for (BigDecimal slot : slots) {
            if (slot != null) {
                return false;
            }
        }
        return true;
    }

    public QuarterAmounts with(Quarter quarter, BigDecimal amount) {
        BigDecimal[] copy = slots.clone();
        copy[quarter.index()] = amount;
        return new QuarterAmounts(copy);
    }

    /**
     * Adds to the quarter's slot; accumulates instead of overwriting
     */
    public QuarterAmounts plus(Quarter quarter, BigDecimal amount) {
        return with(quarter, get(quarter).add(amount));
    }

    public BigDecimal sum() {
        BigDecimal total = BigDecimal.ZERO;
        for (Quarter quarter : Quarter.values()) {
            total = total.add(get(quarter));
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QuarterAmounts)) {
            return false;
        }
        return Arrays.equals(slots, ((QuarterAmounts) o).slots);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(slots);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Quarter quarter : Quarter.values()) {
            if (quarter.index() > 0) {
                sb.append(", ");
            }
            sb.append(quarter.key()).append('=').append(Objects.toString(slots[quarter.index()], "-"));
        }
        return sb.append('}').toString();
    }
}
