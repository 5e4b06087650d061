package com.finexec.domain.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityTree;
import com.finexec.domain.model.ClosingBalances;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.Recalculation;
import com.finexec.domain.model.ReportState;
import com.finexec.domain.model.Section;
import com.finexec.domain.model.VatCategory;
import com.finexec.domain.model.VatPosition;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces the closing snapshot of a quarter, the input of the next quarter's rollover
 */
public class ClosingBalancesExtractor {

    public ClosingBalances extract(ReportContext context, Recalculation recalculation) {
        ActivityTree tree = context.getTree();
        Quarter quarter = context.getQuarter();
        ReportState state = recalculation.state();

        Map<VatCategory, BigDecimal> vat = new EnumMap<>(VatCategory.class);
        for (VatPosition position : recalculation.balances().getVatReceivables().values()) {
            vat.put(position.category(), position.closing());
        }

        return ClosingBalances.builder()
                .assets(sectionValues(tree, Section.D, state, quarter))
                .liabilities(sectionValues(tree, Section.E, state, quarter))
                .equity(sectionValues(tree, Section.G, state, quarter))
                .vat(vat)
                .closingBalanceTotal(recalculation.computedValues().getClosingBalance().getCumulativeBalance())
                .build();
    }

    private static Map<String, BigDecimal> sectionValues(ActivityTree tree, Section section, ReportState state,
                                                         Quarter quarter) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (Activity activity : tree.leaves(section, activity -> !activity.isComputed())) {
            values.put(activity.getCode(), state.amount(activity.getCode(), quarter));
        }
        return values;
    }
}
