package com.finexec.domain.model;

/**
 * Special meaning of a catalog line inside the balance formulas
 */
public enum LineRole {
    NONE,
    CASH_AT_BANK,
    OTHER_RECEIVABLES,
    ACCUMULATED_SURPLUS,
    PERIOD_SURPLUS,
    PRIOR_YEAR_CASH,
    PRIOR_YEAR_PAYABLE,
    PRIOR_YEAR_RECEIVABLE
}
