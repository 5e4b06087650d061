package com.finexec.domain.service;

import com.finexec.domain.model.Quarter;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Fiscal year running July to June: Q1 Jul-Sep, Q2 Oct-Dec, Q3 Jan-Mar, Q4 Apr-Jun
 */
public final class FiscalCalendar {

    private FiscalCalendar() {
    }

    public static Quarter quarterOf(LocalDate date) {
        int month = date.getMonthValue();
        if (month >= 7 && month <= 9) {
            return Quarter.Q1;
        }
        if (month >= 10) {
            return Quarter.Q2;
        }
        if (month <= 3) {
            return Quarter.Q3;
        }
        return Quarter.Q4;
    }

    /**
     * Calendar year in which the fiscal year starts
     */
    public static int fiscalYear(LocalDate date) {
        return date.getMonthValue() >= 7 ? date.getYear() : date.getYear() - 1;
    }

    public static Quarter currentQuarter(Clock clock) {
        return quarterOf(LocalDate.now(clock));
    }
}
