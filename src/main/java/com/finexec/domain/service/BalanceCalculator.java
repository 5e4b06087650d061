package com.finexec.domain.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityTree;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.BalancePolicy;
import com.finexec.domain.model.BalanceSnapshot;
import com.finexec.domain.model.ExpenseLine;
import com.finexec.domain.model.PayablePosition;
import com.finexec.domain.model.PreviousQuarterBalances;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.ReportState;
import com.finexec.domain.model.Section;
import com.finexec.domain.model.VatCategory;
import com.finexec.domain.model.VatPosition;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Double-entry balance formulas for the active quarter.
 *
 * <pre>
 * cash       = openingCash + receipts - paidExpenses - miscAdjustments
 *              + vatCleared - payablesCleared + otherReceivablesCleared + priorYearCash
 * payable    = opening + unpaid portions of mapped expenses - cleared + priorYearAdjustment
 * vat        = opening + incurred - cleared + priorYearAdjustment
 * other rec. = opening + miscAdjustments + priorYearAdjustment - cleared
 * </pre>
 */
@Slf4j
public class BalanceCalculator {

    private final RolloverResolver rolloverResolver;

    public BalanceCalculator(RolloverResolver rolloverResolver) {
        this.rolloverResolver = rolloverResolver;
    }

    public BalanceSnapshot calculate(ReportContext context, ReportState state) {
        ActivityTree tree = context.getTree();
        ActivityMappings mappings = context.getMappings();
        Quarter quarter = context.getQuarter();
        PreviousQuarterBalances previous = context.getPrevious();

        List<ExpenseLine> ledger = new ExpenseLedger(mappings).buildLedger(tree.expenses(), state, quarter);

        BigDecimal openingCash = openingCash(mappings.cashAtBankCode(), state, quarter, previous);
        BigDecimal receipts = sumAmounts(tree.leaves(Section.A, activity -> !activity.isComputed()), state, quarter);
        BigDecimal paidExpenses = ledger.stream().map(ExpenseLine::getAmountPaid).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal miscAdjustments = sumAmounts(tree.leaves(Section.X), state, quarter);

        BigDecimal vatCleared = ledger.stream().map(ExpenseLine::getVatCleared).reduce(BigDecimal.ZERO, BigDecimal::add);
        for (Activity receivable : tree.vatReceivables()) {
            vatCleared = vatCleared.add(state.value(receivable.getCode()).getVatCleared().get(quarter));
        }

        BigDecimal payablesCleared = BigDecimal.ZERO;
        for (Activity payable : tree.payables()) {
            payablesCleared = payablesCleared.add(state.value(payable.getCode()).getPayableCleared().get(quarter));
        }

        BigDecimal otherReceivablesCleared = BigDecimal.ZERO;
        for (Activity asset : tree.leaves(Section.D)) {
            otherReceivablesCleared = otherReceivablesCleared.add(
                    state.value(asset.getCode()).getOtherReceivableCleared().get(quarter));
        }

        BigDecimal priorYearCash = mappings.priorYearCashCode()
                .map(code -> state.amount(code, quarter))
                .orElse(BigDecimal.ZERO);

        BigDecimal cash = openingCash
                .add(receipts)
                .subtract(paidExpenses)
                .subtract(miscAdjustments)
                .add(vatCleared)
                .subtract(payablesCleared)
                .add(otherReceivablesCleared)
                .add(priorYearCash);

        log.debug("Cash {} = opening {} + receipts {} - paid {} - misc {} + vatCleared {} - payablesCleared {}"
                        + " + otherReceivablesCleared {} + priorYearCash {}",
                quarter, openingCash, receipts, paidExpenses, miscAdjustments, vatCleared, payablesCleared,
                otherReceivablesCleared, priorYearCash);

        Map<String, PayablePosition> payables = payables(tree, state, quarter, previous, ledger);
        Map<VatCategory, VatPosition> vat = vatReceivables(mappings, state, quarter, previous, ledger);

        String otherReceivablesCode = mappings.otherReceivablesCode().orElse(null);
        BigDecimal openingOther = rolloverResolver.openingOtherReceivables(otherReceivablesCode, previous);
        BigDecimal otherReceivables = openingOther;
        if (otherReceivablesCode != null) {
            ActivityValue value = state.value(otherReceivablesCode);
            otherReceivables = openingOther
                    .add(miscAdjustments)
                    .add(value.getPriorYearAdjustment().get(quarter))
                    .subtract(value.getOtherReceivableCleared().get(quarter));
        }
        otherReceivables = BalancePolicy.OTHER_RECEIVABLE.apply(otherReceivables);

        return BalanceSnapshot.builder()
                .quarter(quarter)
                .openingCash(openingCash)
                .receipts(receipts)
                .paidExpenses(paidExpenses)
                .miscellaneousAdjustments(miscAdjustments)
                .vatCleared(vatCleared)
                .payablesCleared(payablesCleared)
                .otherReceivablesCleared(otherReceivablesCleared)
                .priorYearCashAdjustment(priorYearCash)
                .cashAtBank(cash)
                .payables(Collections.unmodifiableMap(payables))
                .vatReceivables(Collections.unmodifiableMap(vat))
                .openingOtherReceivables(openingOther)
                .otherReceivables(otherReceivables)
                .ledger(Collections.unmodifiableList(ledger))
                .build();
    }

    /**
     * Q1 seeds from the rollover snapshot; later quarters chain from this report's own previous quarter
     * when that quarter has a cash figure.
     */
    private BigDecimal openingCash(Optional<String> cashCode, ReportState state, Quarter quarter,
                                   PreviousQuarterBalances previous) {
        if (cashCode.isEmpty()) {
            return BigDecimal.ZERO;
        }
        Optional<Quarter> prior = quarter.previous();
        if (prior.isPresent()) {
            BigDecimal chained = state.value(cashCode.get()).getAmounts().rawValue(prior.get());
            if (chained != null) {
                return chained;
            }
        }
        return rolloverResolver.openingCash(cashCode.get(), previous);
    }

    private Map<String, PayablePosition> payables(ActivityTree tree, ReportState state, Quarter quarter,
                                                  PreviousQuarterBalances previous, List<ExpenseLine> ledger) {
        Map<String, BigDecimal> openings = rolloverResolver.openingPayables(previous);
        Map<String, PayablePosition> positions = new LinkedHashMap<>();
        for (Activity payable : tree.payables()) {
            String code = payable.getCode();
            ActivityValue value = state.value(code);

            BigDecimal opening = openings.getOrDefault(code, BigDecimal.ZERO);
            BigDecimal incurred = BigDecimal.ZERO;
            for (ExpenseLine line : ledger) {
                if (code.equals(line.getPayableCode())) {
                    incurred = incurred.add(line.unpaidPortion());
                }
            }
            BigDecimal cleared = value.getPayableCleared().get(quarter);
            BigDecimal adjustment = value.getPriorYearAdjustment().get(quarter);
            BigDecimal unclamped = opening.add(incurred).subtract(cleared).add(adjustment);

            positions.put(code, new PayablePosition(code, opening, incurred, cleared, adjustment,
                    unclamped, BalancePolicy.PAYABLE.apply(unclamped)));
        }
        return positions;
    }

    private Map<VatCategory, VatPosition> vatReceivables(ActivityMappings mappings, ReportState state, Quarter quarter,
                                                         PreviousQuarterBalances previous, List<ExpenseLine> ledger) {
        Map<VatCategory, BigDecimal> openings = rolloverResolver.openingVat(previous);
        Map<VatCategory, VatPosition> positions = new EnumMap<>(VatCategory.class);
        for (VatCategory category : VatCategory.values()) {
            String receivableCode = mappings.vatReceivableFor(category).orElse(null);

            BigDecimal incurred = BigDecimal.ZERO;
            BigDecimal cleared = BigDecimal.ZERO;
            for (ExpenseLine line : ledger) {
                if (line.getVatCategory() == category) {
                    incurred = incurred.add(line.getVatAmount());
                    cleared = cleared.add(line.getVatCleared());
                }
            }
            BigDecimal adjustment = BigDecimal.ZERO;
            if (receivableCode != null) {
                ActivityValue value = state.value(receivableCode);
                cleared = cleared.add(value.getVatCleared().get(quarter));
                adjustment = value.getPriorYearAdjustment().get(quarter);
            }
            BigDecimal opening = openings.getOrDefault(category, BigDecimal.ZERO);
            BigDecimal unclamped = opening.add(incurred).subtract(cleared).add(adjustment);

            positions.put(category, new VatPosition(category, receivableCode, opening, incurred, cleared,
                    adjustment, unclamped, BalancePolicy.VAT_RECEIVABLE.apply(unclamped)));
        }
        return positions;
    }

    private static BigDecimal sumAmounts(List<Activity> activities, ReportState state, Quarter quarter) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Activity activity : activities) {
            sum = sum.add(state.amount(activity.getCode(), quarter));
        }
        return sum;
    }
}
