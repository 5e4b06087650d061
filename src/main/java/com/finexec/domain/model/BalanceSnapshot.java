package com.finexec.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Balances derived by the balance calculator for the active quarter
 */
@Value
@Builder
public class BalanceSnapshot {
    Quarter quarter;
    BigDecimal openingCash;
    BigDecimal receipts;
    BigDecimal paidExpenses;
    BigDecimal miscellaneousAdjustments;
    BigDecimal vatCleared;
    BigDecimal payablesCleared;
    BigDecimal otherReceivablesCleared;
    BigDecimal priorYearCashAdjustment;
    BigDecimal cashAtBank;
    Map<String, PayablePosition> payables;
    Map<VatCategory, VatPosition> vatReceivables;
    BigDecimal openingOtherReceivables;
    BigDecimal otherReceivables;
    List<ExpenseLine> ledger;
}
