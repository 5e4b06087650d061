package com.finexec.application.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityTree;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.BalanceSnapshot;
import com.finexec.domain.model.ComputedValues;
import com.finexec.domain.model.ExpenseLine;
import com.finexec.domain.model.LineRole;
import com.finexec.domain.model.MiscellaneousAdjustmentCheck;
import com.finexec.domain.model.PayablePosition;
import com.finexec.domain.model.PaymentStatus;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.Recalculation;
import com.finexec.domain.model.ReportState;
import com.finexec.domain.model.VatPosition;
import com.finexec.domain.service.ReportContext;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates a recomputed report.
 * Blocking: negative amounts, over-payment, over-clearance, over-budget.
 * Informational: net financial assets vs closing balance.
 */
public class ExecutionValidator {

    public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");

    static final String TOTAL_EXPENDITURES_FIELD = "total_expenditures";
    static final String ACCOUNTING_EQUATION_FIELD = "accounting_equation";

    private final BigDecimal tolerance;

    public ExecutionValidator(BigDecimal tolerance) {
        this.tolerance = tolerance;
    }

    public ExecutionValidator() {
        this(DEFAULT_TOLERANCE);
    }

    public ValidationResult validate(ReportContext context, Recalculation recalculation, BigDecimal plannedBudget) {
        List<ValidationIssue> issues = new ArrayList<>();

        validateNonNegative(context, recalculation.state(), issues);
        validatePayments(context, recalculation, issues);
        validateClearances(recalculation.balances(), context.getTree(), issues);
        validateBudget(context.getQuarter(), recalculation.computedValues(), plannedBudget, issues);
        validateAccountingEquation(recalculation.computedValues(), issues);

        return ValidationResult.of(issues);
    }

    /**
     * The adjustment must be non-negative and fit within the cash available before it
     */
    public MiscellaneousAdjustmentCheck checkMiscellaneousAdjustment(BigDecimal amount, BalanceSnapshot balances) {
        BigDecimal available = balances.getCashAtBank().add(balances.getMiscellaneousAdjustments());
        BigDecimal maxAllowable = available.signum() > 0 ? available : BigDecimal.ZERO;
        if (amount == null || amount.signum() < 0) {
            return MiscellaneousAdjustmentCheck.invalid("Amount cannot be negative", maxAllowable);
        }
        if (amount.compareTo(maxAllowable) > 0) {
            return MiscellaneousAdjustmentCheck.invalid(
                    "Amount cannot exceed available cash (" + maxAllowable.toPlainString() + ")", maxAllowable);
        }
        return MiscellaneousAdjustmentCheck.valid(maxAllowable);
    }

    private void validateNonNegative(ReportContext context, ReportState state, List<ValidationIssue> issues) {
        Quarter quarter = context.getQuarter();
        for (Activity activity : context.getTree().allLeaves()) {
            if (!activity.getSection().isNonNegative()) {
                continue;
            }
            BigDecimal value = state.amount(activity.getCode(), quarter);
            if (value.signum() >= 0) {
                continue;
            }
            if (activity.hasRole(LineRole.OTHER_RECEIVABLES)) {
                issues.add(ValidationIssue.error(activity.getCode(),
                        activity.getName() + " cleared exceeds the outstanding balance by "
                                + value.negate().toPlainString() + "."));
            } else {
                issues.add(ValidationIssue.error(activity.getCode(),
                        activity.getName() + " cannot be negative. Please enter a positive value or zero."));
            }
        }
    }

    private void validatePayments(ReportContext context, Recalculation recalculation, List<ValidationIssue> issues) {
        Quarter quarter = context.getQuarter();
        for (ExpenseLine line : recalculation.balances().getLedger()) {
            ActivityValue value = recalculation.state().value(line.getCode());
            PaymentStatus recordedStatus = value.getPaymentStatus().get(quarter).orElse(PaymentStatus.UNPAID);
            if (recordedStatus == PaymentStatus.UNPAID) {
                continue;
            }
            BigDecimal recordedPaid = value.getAmountPaid().get(quarter);
            if (recordedPaid.compareTo(line.getGrossAmount()) > 0) {
                issues.add(ValidationIssue.error(line.getCode(), "Payment amount (" + recordedPaid.toPlainString()
                        + ") cannot exceed expense amount (" + line.getGrossAmount().toPlainString()
                        + ") for " + line.getName() + "."));
            } else if (recordedStatus == PaymentStatus.PARTIAL && line.getGrossAmount().signum() > 0
                    && recordedPaid.signum() <= 0) {
                issues.add(ValidationIssue.error(line.getCode(),
                        "Partial payment for " + line.getName() + " requires an amount paid greater than zero."));
            }
        }
    }

    private void validateClearances(BalanceSnapshot balances, ActivityTree tree, List<ValidationIssue> issues) {
        for (VatPosition position : balances.getVatReceivables().values()) {
            if (position.unclamped().signum() < 0) {
                String field = position.receivableCode() != null
                        ? position.receivableCode() : position.category().getValue();
                issues.add(ValidationIssue.error(field, "VAT cleared for " + position.category().getLabel()
                        + " exceeds the outstanding VAT receivable by " + position.unclamped().negate().toPlainString()
                        + "."));
            }
        }
        for (PayablePosition position : balances.getPayables().values()) {
            if (position.unclamped().signum() < 0) {
                String name = tree.find(position.code()).map(Activity::getName).orElse(position.code());
                issues.add(ValidationIssue.error(position.code(), "Amount cleared for " + name
                        + " exceeds the outstanding payable by " + position.unclamped().negate().toPlainString()
                        + "."));
            }
        }
    }

    private void validateBudget(Quarter quarter, ComputedValues computed, BigDecimal plannedBudget,
                                List<ValidationIssue> issues) {
        if (plannedBudget == null || plannedBudget.signum() <= 0) {
            return;
        }
        BigDecimal spent = computed.getExpenditures().get(quarter);
        if (spent.compareTo(plannedBudget) > 0) {
            issues.add(ValidationIssue.error(TOTAL_EXPENDITURES_FIELD, "Total expenditures ("
                    + spent.toPlainString() + ") exceed the planned budget (" + plannedBudget.toPlainString()
                    + ") for " + quarter.getValue() + "."));
        }
    }

    private void validateAccountingEquation(ComputedValues computed, List<ValidationIssue> issues) {
        BigDecimal netFinancialAssets = computed.getNetFinancialAssets().getCumulativeBalance();
        BigDecimal closingBalance = computed.getClosingBalance().getCumulativeBalance();
        BigDecimal difference = netFinancialAssets.subtract(closingBalance);
        if (difference.abs().compareTo(tolerance) > 0) {
            issues.add(ValidationIssue.warning(ACCOUNTING_EQUATION_FIELD, "Net financial assets ("
                    + netFinancialAssets.toPlainString() + ") do not match the closing balance ("
                    + closingBalance.toPlainString() + "); difference " + difference.toPlainString() + "."));
        }
    }
}
