package com.finexec.domain.model;

import java.math.BigDecimal;

/**
 * Result of checking a proposed miscellaneous adjustment against available cash
 */
public record MiscellaneousAdjustmentCheck(boolean isValid, String error, BigDecimal maxAllowableAmount) {

    public static MiscellaneousAdjustmentCheck valid(BigDecimal maxAllowableAmount) {
        return new MiscellaneousAdjustmentCheck(true, null, maxAllowableAmount);
    }

    public static MiscellaneousAdjustmentCheck invalid(String error, BigDecimal maxAllowableAmount) {
        return new MiscellaneousAdjustmentCheck(false, error, maxAllowableAmount);
    }
}
