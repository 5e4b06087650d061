package com.finexec.domain.model;

import java.math.BigDecimal;

/**
 * VAT receivable balance of one category for the active quarter
 */
public record VatPosition(
        VatCategory category,
        String receivableCode,  // nullable when the catalog has no line for the category
        BigDecimal opening,
        BigDecimal incurred,
        BigDecimal cleared,
        BigDecimal priorYearAdjustment,
        BigDecimal unclamped,
        BigDecimal closing
) {}
