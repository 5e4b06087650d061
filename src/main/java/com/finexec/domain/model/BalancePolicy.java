package com.finexec.domain.model;

import java.math.BigDecimal;

/**
 * Floor applied to each kind of derived balance.
 * Payables and VAT receivables cannot be negative; other receivables keep negative values
 * so that over-clearance reaches the validator.
 */
public enum BalancePolicy {
    PAYABLE(true),
    VAT_RECEIVABLE(true),
    OTHER_RECEIVABLE(false);

    private final boolean floorAtZero;

    BalancePolicy(boolean floorAtZero) {
        this.floorAtZero = floorAtZero;
    }

    public boolean isFloorAtZero() {
        return floorAtZero;
    }

    public BigDecimal apply(BigDecimal raw) {
        if (floorAtZero && raw.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return raw;
    }
}
