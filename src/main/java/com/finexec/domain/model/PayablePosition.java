package com.finexec.domain.model;

import java.math.BigDecimal;

/**
 * Payable balance of one Section E line for the active quarter.
 * {@code unclamped} keeps the raw formula result so over-clearance stays visible.
 */
public record PayablePosition(
        String code,
        BigDecimal opening,
        BigDecimal incurred,
        BigDecimal cleared,
        BigDecimal priorYearAdjustment,
        BigDecimal unclamped,
        BigDecimal closing
) {}
