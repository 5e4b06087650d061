package com.finexec.domain.model;

import lombok.Value;

/**
 * Prior quarter's finalized closing snapshot, read-only for the session
 */
@Value
public class PreviousQuarterBalances {

    private static final PreviousQuarterBalances NONE = new PreviousQuarterBalances(false, null, null);

    boolean exists;
    Quarter quarter;
    ClosingBalances closingBalances;

    public static PreviousQuarterBalances none() {
        return NONE;
    }

    public static PreviousQuarterBalances of(Quarter quarter, ClosingBalances closingBalances) {
        return new PreviousQuarterBalances(true, quarter, closingBalances);
    }

    /**
     * Whether there is any usable closing data to roll forward
     */
    public boolean hasData() {
        return exists && closingBalances != null;
    }
}
