package com.finexec.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Normalized view of one expense line for one quarter
 */
@Value
@Builder
public class ExpenseLine {
    String code;
    String name;
    String payableCode;  // null: always paid, never payable
    VatCategory vatCategory;  // null when not VAT-applicable
    BigDecimal grossAmount;
    BigDecimal netAmount;
    BigDecimal vatAmount;
    BigDecimal vatCleared;
    PaymentStatus paymentStatus;
    BigDecimal amountPaid;

    /**
     * Portion of the invoice still owed to the supplier
     */
    public BigDecimal unpaidPortion() {
        BigDecimal unpaid = grossAmount.subtract(amountPaid);
        return unpaid.signum() > 0 ? unpaid : BigDecimal.ZERO;
    }

    public boolean isVatApplicable() {
        return vatCategory != null;
    }
}
