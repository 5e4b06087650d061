package com.finexec.domain.model;

import java.math.BigDecimal;

/**
 * Outcome of an accounting-equation verification
 */
public record BalanceVerification(
        boolean balanced,
        BigDecimal netFinancialAssets,
        BigDecimal closingBalance,
        BigDecimal difference,
        VerificationSource source
) {
    public static BalanceVerification fallback() {
        return new BalanceVerification(true, null, null, BigDecimal.ZERO, VerificationSource.FALLBACK);
    }
}
