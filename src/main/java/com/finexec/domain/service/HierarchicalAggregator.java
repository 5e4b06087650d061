package com.finexec.domain.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityCategory;
import com.finexec.domain.model.ActivitySubCategory;
import com.finexec.domain.model.AggregationRule;
import com.finexec.domain.model.LineRole;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.QuarterAmounts;
import com.finexec.domain.model.QuarterlyTotals;
import com.finexec.domain.model.ReportState;
import com.finexec.domain.model.RowKind;
import com.finexec.domain.model.StatementRow;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sums the activity tree bottom-up into subcategory and category rows.
 * Quarterly values always add up; the cumulative balance follows the section's
 * aggregation rule (flow: sum of children, stock: latest reported quarter).
 */
public class HierarchicalAggregator {

    public StatementRow aggregate(ActivityCategory category, ReportState state, Quarter current) {
        return aggregate(category, state, current, Map.of());
    }

    /**
     * @param overrides totals to use for specific leaf codes instead of their stored values
     */
    public StatementRow aggregate(ActivityCategory category, ReportState state, Quarter current,
                                  Map<String, QuarterlyTotals> overrides) {
        AggregationRule rule = category.getSection().getAggregationRule();
        List<Ordered> children = new ArrayList<>();

        for (Activity item : category.getItems()) {
            if (item.isAggregationInput()) {
                children.add(new Ordered(item.getDisplayOrder(), leafRow(item, rule, state, current, overrides)));
            }
        }
        for (ActivitySubCategory subCategory : category.getSubCategories()) {
            List<StatementRow> leaves = new ArrayList<>();
            subCategory.getItems().stream()
                    .filter(Activity::isAggregationInput)
                    .sorted(Comparator.comparingInt(Activity::getDisplayOrder))
                    .forEach(item -> leaves.add(leafRow(item, rule, state, current, overrides)));
            children.add(new Ordered(subCategory.getDisplayOrder(), StatementRow.builder()
                    .id(subCategory.getCode())
                    .title(subCategory.getLabel())
                    .kind(RowKind.SUBCATEGORY)
                    .calculated(true)
                    .totals(combine(leaves, rule))
                    .children(leaves)
                    .build()));
        }

        children.sort(Comparator.comparingInt(Ordered::order));
        List<StatementRow> rows = new ArrayList<>();
        children.forEach(child -> rows.add(child.row()));

        return StatementRow.builder()
                .id(category.getSection().getValue())
                .title(category.getLabel())
                .kind(RowKind.CATEGORY)
                .calculated(true)
                .totals(combine(rows, rule))
                .children(rows)
                .build();
    }

    /**
     * Totals of a single line. Reported quarters are those with a stored value, a non-zero value,
     * or any quarter up to the current one.
     */
    QuarterlyTotals leafTotals(Activity activity, AggregationRule rule, ReportState state, Quarter current) {
        QuarterAmounts amounts = state.value(activity.getCode()).getAmounts();
        BigDecimal[] values = new BigDecimal[Quarter.values().length];
        Set<Quarter> reported = EnumSet.noneOf(Quarter.class);
        for (Quarter quarter : Quarter.values()) {
            values[quarter.index()] = amounts.get(quarter);
            if (amounts.isReported(quarter) || amounts.get(quarter).signum() != 0 || !quarter.isAfter(current)) {
                reported.add(quarter);
            }
        }
        if (activity.hasRole(LineRole.ACCUMULATED_SURPLUS)) {
            // constant across the year, counted once
            return QuarterlyTotals.withCumulative(values, reported, values[0]);
        }
        return QuarterlyTotals.of(values, reported, rule);
    }

    private StatementRow leafRow(Activity activity, AggregationRule rule, ReportState state, Quarter current,
                                 Map<String, QuarterlyTotals> overrides) {
        QuarterlyTotals totals = overrides.containsKey(activity.getCode())
                ? overrides.get(activity.getCode())
                : leafTotals(activity, rule, state, current);
        return StatementRow.builder()
                .id(activity.getCode())
                .title(activity.getName())
                .kind(RowKind.ACTIVITY)
                .editable(activity.isUserEditable())
                .calculated(!activity.isUserEditable())
                .totals(totals)
                .build();
    }

    /**
     * Quarter values are summed. Flow rows add up the children's cumulative balances,
     * stock rows take the latest reported quarter of the summed values.
     */
    static QuarterlyTotals combine(List<StatementRow> children, AggregationRule rule) {
        BigDecimal[] values = {BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO};
        Set<Quarter> reported = EnumSet.noneOf(Quarter.class);
        BigDecimal cumulative = BigDecimal.ZERO;
        for (StatementRow child : children) {
            QuarterlyTotals totals = child.getTotals();
            for (Quarter quarter : Quarter.values()) {
                values[quarter.index()] = values[quarter.index()].add(totals.get(quarter));
            }
            reported.addAll(totals.getReported());
            cumulative = cumulative.add(totals.getCumulativeBalance());
        }
        if (rule == AggregationRule.FLOW) {
            return QuarterlyTotals.withCumulative(values, reported, cumulative);
        }
        return QuarterlyTotals.of(values, reported, rule);
    }

    private record Ordered(int order, StatementRow row) {}
}
