package com.finexec.domain.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityCategory;
import com.finexec.domain.model.ActivityTree;
import com.finexec.domain.model.AggregationRule;
import com.finexec.domain.model.ComputedValues;
import com.finexec.domain.model.LineRole;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.QuarterlyTotals;
import com.finexec.domain.model.ReportState;
import com.finexec.domain.model.RowKind;
import com.finexec.domain.model.Section;
import com.finexec.domain.model.StatementProjection;
import com.finexec.domain.model.StatementRow;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the derived sections on top of the aggregated line items:
 * C = A - B, F = D - E, G = accumulated surplus + prior-year adjustments + C.
 */
public class DerivedSectionEngine {

    private final HierarchicalAggregator aggregator;

    public DerivedSectionEngine(HierarchicalAggregator aggregator) {
        this.aggregator = aggregator;
    }

    public StatementProjection derive(ActivityTree tree, ReportState state, Quarter current) {
        Map<Section, StatementRow> rows = new EnumMap<>(Section.class);
        for (Section section : List.of(Section.A, Section.B, Section.D, Section.E, Section.X)) {
            tree.category(section).ifPresent(category ->
                    rows.put(section, aggregator.aggregate(category, state, current)));
        }

        QuarterlyTotals receipts = totalsOf(rows, Section.A);
        QuarterlyTotals expenditures = totalsOf(rows, Section.B);
        QuarterlyTotals assets = totalsOf(rows, Section.D);
        QuarterlyTotals liabilities = totalsOf(rows, Section.E);

        QuarterlyTotals surplus = surplus(receipts, expenditures);
        QuarterlyTotals netFinancialAssets = netFinancialAssets(assets, liabilities, current);

        tree.category(Section.C).ifPresent(category -> rows.put(Section.C, derivedRow(category, surplus)));
        tree.category(Section.F).ifPresent(category -> rows.put(Section.F, derivedRow(category, netFinancialAssets)));

        Map<String, QuarterlyTotals> overrides = tree.findByRole(LineRole.PERIOD_SURPLUS)
                .map(activity -> Map.of(activity.getCode(), surplus))
                .orElse(Map.of());
        tree.category(Section.G).ifPresent(category ->
                rows.put(Section.G, aggregator.aggregate(category, state, current, overrides)));
        QuarterlyTotals closingBalance = totalsOf(rows, Section.G);

        ComputedValues computed = ComputedValues.builder()
                .receipts(receipts)
                .expenditures(expenditures)
                .surplus(surplus)
                .financialAssets(assets)
                .financialLiabilities(liabilities)
                .netFinancialAssets(netFinancialAssets)
                .closingBalance(closingBalance)
                .build();

        List<StatementRow> table = new ArrayList<>();
        tree.getCategories().values().stream()
                .sorted(Comparator.comparingInt(ActivityCategory::getDisplayOrder))
                .forEach(category -> {
                    StatementRow row = rows.get(category.getSection());
                    if (row != null) {
                        table.add(row);
                    }
                });
        return new StatementProjection(computed, table);
    }

    /**
     * C = A - B per quarter, flow cumulative
     */
    public QuarterlyTotals surplus(QuarterlyTotals receipts, QuarterlyTotals expenditures) {
        BigDecimal[] values = new BigDecimal[Quarter.values().length];
        Set<Quarter> reported = EnumSet.noneOf(Quarter.class);
        reported.addAll(receipts.getReported());
        reported.addAll(expenditures.getReported());
        for (Quarter quarter : Quarter.values()) {
            values[quarter.index()] = receipts.get(quarter).subtract(expenditures.get(quarter));
        }
        return QuarterlyTotals.of(values, reported, AggregationRule.FLOW);
    }

    /**
     * F = D - E per quarter; cumulative is the latest reported quarter
     */
    public QuarterlyTotals netFinancialAssets(QuarterlyTotals assets, QuarterlyTotals liabilities, Quarter current) {
        BigDecimal[] values = new BigDecimal[Quarter.values().length];
        Set<Quarter> reported = EnumSet.noneOf(Quarter.class);
        reported.addAll(assets.getReported());
        reported.addAll(liabilities.getReported());
        for (Quarter quarter : Quarter.values()) {
            values[quarter.index()] = assets.get(quarter).subtract(liabilities.get(quarter));
            if (!quarter.isAfter(current)) {
                reported.add(quarter);
            }
        }
        return QuarterlyTotals.of(values, reported, AggregationRule.STOCK);
    }

    private StatementRow derivedRow(ActivityCategory category, QuarterlyTotals totals) {
        List<StatementRow> children = new ArrayList<>();
        category.allItems().stream()
                .filter(Activity::isAggregationInput)
                .sorted(Comparator.comparingInt(Activity::getDisplayOrder))
                .forEach(item -> children.add(StatementRow.builder()
                        .id(item.getCode())
                        .title(item.getName())
                        .kind(RowKind.ACTIVITY)
                        .calculated(true)
                        .totals(totals)
                        .build()));
        return StatementRow.builder()
                .id(category.getSection().getValue())
                .title(category.getLabel())
                .kind(RowKind.CATEGORY)
                .calculated(true)
                .totals(totals)
                .children(children)
                .build();
    }

    private static QuarterlyTotals totalsOf(Map<Section, StatementRow> rows, Section section) {
        StatementRow row = rows.get(section);
        return row == null ? QuarterlyTotals.zero() : row.getTotals();
    }
}
