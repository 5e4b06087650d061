package com.finexec.domain.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.BalanceSnapshot;
import com.finexec.domain.model.LineRole;
import com.finexec.domain.model.PayablePosition;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.QuarterAmounts;
import com.finexec.domain.model.Recalculation;
import com.finexec.domain.model.ReportState;
import com.finexec.domain.model.StatementProjection;
import com.finexec.domain.model.VatPosition;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Pure full recomputation: {@code recompute(state) -> (state', computedValues)}.
 * Holds no state between calls; the host invokes it after every mutation.
 */
public class ReportRecalculationEngine {

    private final RolloverResolver rolloverResolver;
    private final BalanceCalculator balanceCalculator;
    private final DerivedSectionEngine derivedSectionEngine;

    public ReportRecalculationEngine(CodeMappingTable codeMapping) {
        this.rolloverResolver = new RolloverResolver(codeMapping);
        this.balanceCalculator = new BalanceCalculator(rolloverResolver);
        this.derivedSectionEngine = new DerivedSectionEngine(new HierarchicalAggregator());
    }

    public ReportRecalculationEngine() {
        this(CodeMappingTable.defaultTable());
    }

    public Recalculation recompute(ReportContext context, ReportState state) {
        ReportState seeded = seedAccumulatedSurplus(context, state);
        BalanceSnapshot balances = balanceCalculator.calculate(context, seeded);
        ReportState next = applyBalances(context, seeded, balances);
        StatementProjection projection = derivedSectionEngine.derive(context.getTree(), next, context.getQuarter());
        return new Recalculation(next, balances, projection.computedValues(), projection.rows());
    }

    /**
     * Writes the derived balances into the current quarter's slots
     */
    private ReportState applyBalances(ReportContext context, ReportState state, BalanceSnapshot balances) {
        Quarter quarter = context.getQuarter();
        ReportState next = state;

        Optional<String> cashCode = context.getMappings().cashAtBankCode();
        if (cashCode.isPresent()) {
            next = next.update(cashCode.get(), value -> value.withAmount(quarter, balances.getCashAtBank()));
        }
        for (PayablePosition payable : balances.getPayables().values()) {
            next = next.update(payable.code(), value -> value.withAmount(quarter, payable.closing()));
        }
        for (VatPosition vat : balances.getVatReceivables().values()) {
            if (vat.receivableCode() != null) {
                next = next.update(vat.receivableCode(), value -> value.withAmount(quarter, vat.closing()));
            }
        }
        Optional<String> otherCode = context.getMappings().otherReceivablesCode();
        if (otherCode.isPresent()) {
            next = next.update(otherCode.get(), value -> value.withAmount(quarter, balances.getOtherReceivables()));
        }
        return next;
    }

    /**
     * Accumulated surplus is constant over the year: taken from the rollover snapshot when it
     * carries one, else whatever Q1 holds.
     */
    private ReportState seedAccumulatedSurplus(ReportContext context, ReportState state) {
        Optional<Activity> line = context.getTree().findByRole(LineRole.ACCUMULATED_SURPLUS);
        if (line.isEmpty()) {
            return state;
        }
        String code = line.get().getCode();
        BigDecimal seed = rolloverResolver.accumulatedSurplusSeed(code, context.getQuarter(), context.getPrevious())
                .orElse(state.value(code).getAmounts().rawValue(Quarter.Q1));
        if (seed == null) {
            return state;
        }
        QuarterAmounts constant = QuarterAmounts.of(seed, seed, seed, seed);
        return state.update(code, value -> value.toBuilder().amounts(constant).build());
    }
}
