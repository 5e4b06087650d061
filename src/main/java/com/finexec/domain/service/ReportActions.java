package com.finexec.domain.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.AdjustmentDirection;
import com.finexec.domain.model.LineRole;
import com.finexec.domain.model.PaymentStatus;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.ReportState;
import com.finexec.domain.model.Section;

import java.math.BigDecimal;

/**
 * User actions on a report draft. Each action returns a new state for the current quarter;
 * clearances post to the cleared-amount ledger and to Cash at Bank in the same update.
 */
public class ReportActions {

    private final ReportContext context;

    public ReportActions(ReportContext context) {
        this.context = context;
    }

    public ReportState setAmount(ReportState state, String code, BigDecimal amount) {
        Activity activity = require(code);
        if (!activity.isUserEditable()) {
            throw new InvalidReportActionException("Activity " + code + " is not editable");
        }
        return state.update(code, value -> value.withAmount(quarter(), amount == null ? BigDecimal.ZERO : amount));
    }

    public ReportState setComment(ReportState state, String code, String comment) {
        require(code);
        return state.update(code, value -> value.toBuilder().comment(comment).build());
    }

    /**
     * Records the payment status; a partial payment keeps the entered amount as is
     */
    public ReportState recordPayment(ReportState state, String code, PaymentStatus status, BigDecimal amountPaid) {
        Activity activity = requireExpense(code);
        if (status == null) {
            throw new InvalidReportActionException("Payment status is required for " + activity.getCode());
        }
        Quarter quarter = quarter();
        return state.update(code, value -> {
            ActivityValue.ActivityValueBuilder builder = value.toBuilder()
                    .paymentStatus(value.getPaymentStatus().with(quarter, status));
            if (status == PaymentStatus.PARTIAL) {
                builder.amountPaid(value.getAmountPaid().with(quarter, amountPaid == null ? BigDecimal.ZERO : amountPaid));
            } else if (status == PaymentStatus.UNPAID) {
                builder.amountPaid(value.getAmountPaid().with(quarter, BigDecimal.ZERO));
            }
            return builder.build();
        });
    }

    /**
     * Net and VAT split of a VAT-applicable expense; the quarter amount becomes the net amount
     */
    public ReportState recordVatExpense(ReportState state, String code, BigDecimal netAmount, BigDecimal vatAmount) {
        Activity activity = requireExpense(code);
        if (!activity.isVatApplicable()) {
            throw new InvalidReportActionException("Activity " + code + " is not VAT-applicable");
        }
        Quarter quarter = quarter();
        BigDecimal net = netAmount == null ? BigDecimal.ZERO : netAmount;
        BigDecimal vat = vatAmount == null ? BigDecimal.ZERO : vatAmount;
        return state.update(code, value -> value.toBuilder()
                .amounts(value.getAmounts().with(quarter, net))
                .netAmount(value.getNetAmount().with(quarter, net))
                .vatAmount(value.getVatAmount().with(quarter, vat))
                .build());
    }

    public ReportState clearPayable(ReportState state, String payableCode, BigDecimal amount) {
        Activity payable = require(payableCode);
        if (!payable.isPayable()) {
            throw new InvalidReportActionException("Activity " + payableCode + " is not a payable");
        }
        requirePositive(amount);
        Quarter quarter = quarter();
        ReportState next = state.update(payableCode, value -> value.toBuilder()
                .payableCleared(value.getPayableCleared().plus(quarter, amount))
                .build());
        return adjustCash(next, amount.negate());
    }

    /**
     * VAT refund against a VAT-applicable expense or directly against a VAT receivable line
     */
    public ReportState clearVat(ReportState state, String code, BigDecimal amount) {
        Activity activity = require(code);
        if (!activity.isVatReceivable() && !(activity.isExpense() && activity.isVatApplicable())) {
            throw new InvalidReportActionException("Activity " + code + " carries no VAT receivable");
        }
        requirePositive(amount);
        Quarter quarter = quarter();
        ReportState next = state.update(code, value -> value.toBuilder()
                .vatCleared(value.getVatCleared().plus(quarter, amount))
                .build());
        return adjustCash(next, amount);
    }

    public ReportState clearOtherReceivable(ReportState state, String code, BigDecimal amount) {
        Activity activity = require(code);
        if (!activity.hasRole(LineRole.OTHER_RECEIVABLES)) {
            throw new InvalidReportActionException("Activity " + code + " is not the other receivables line");
        }
        requirePositive(amount);
        Quarter quarter = quarter();
        ReportState next = state.update(code, value -> value.toBuilder()
                .otherReceivableCleared(value.getOtherReceivableCleared().plus(quarter, amount))
                .build());
        return adjustCash(next, amount);
    }

    /**
     * Posts to the adjustment display line and to the target balance's prior-year ledger
     */
    public ReportState applyPriorYearAdjustment(ReportState state, String adjustmentCode, String targetCode,
                                                AdjustmentDirection direction, BigDecimal amount) {
        requireAdjustmentLine(adjustmentCode);
        Activity target = require(targetCode);
        if (!target.isPayable() && !target.isVatReceivable() && !target.hasRole(LineRole.OTHER_RECEIVABLES)) {
            throw new InvalidReportActionException("Activity " + targetCode + " cannot take a prior-year adjustment");
        }
        requirePositive(amount);
        Quarter quarter = quarter();
        BigDecimal signed = direction.signed(amount);
        return state
                .update(adjustmentCode, value -> value.toBuilder()
                        .amounts(value.getAmounts().plus(quarter, signed))
                        .build())
                .update(targetCode, value -> value.toBuilder()
                        .priorYearAdjustment(value.getPriorYearAdjustment().plus(quarter, signed))
                        .build());
    }

    /**
     * Cash adjustments post only to the adjustment line; Cash at Bank picks them up through its formula
     */
    public ReportState applyPriorYearCashAdjustment(ReportState state, String adjustmentCode,
                                                    AdjustmentDirection direction, BigDecimal amount) {
        requireAdjustmentLine(adjustmentCode);
        requirePositive(amount);
        Quarter quarter = quarter();
        BigDecimal signed = direction.signed(amount);
        return state.update(adjustmentCode, value -> value.toBuilder()
                .amounts(value.getAmounts().plus(quarter, signed))
                .build());
    }

    private ReportState adjustCash(ReportState state, BigDecimal delta) {
        return context.getMappings().cashAtBankCode()
                .map(cashCode -> state.update(cashCode, value -> value.toBuilder()
                        .amounts(value.getAmounts().plus(quarter(), delta))
                        .build()))
                .orElse(state);
    }

    private Quarter quarter() {
        return context.getQuarter();
    }

    private Activity require(String code) {
        Activity activity = context.getTree().find(code)
                .orElseThrow(() -> new InvalidReportActionException("Unknown activity: " + code));
        if (activity.isTotalRow()) {
            throw new InvalidReportActionException("Activity " + code + " is a total row");
        }
        return activity;
    }

    private Activity requireExpense(String code) {
        Activity activity = require(code);
        if (!activity.isExpense()) {
            throw new InvalidReportActionException("Activity " + code + " is not an expense");
        }
        return activity;
    }

    private void requireAdjustmentLine(String code) {
        Activity activity = require(code);
        if (activity.getSection() != Section.G
                || activity.hasRole(LineRole.ACCUMULATED_SURPLUS)
                || activity.hasRole(LineRole.PERIOD_SURPLUS)) {
            throw new InvalidReportActionException("Activity " + code + " is not a prior-year adjustment line");
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidReportActionException("Amount must be greater than zero");
        }
    }
}
