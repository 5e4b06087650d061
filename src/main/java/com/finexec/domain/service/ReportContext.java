package com.finexec.domain.service;

import com.finexec.domain.model.ActivityTree;
import com.finexec.domain.model.PreviousQuarterBalances;
import com.finexec.domain.model.Quarter;
import lombok.Value;

/**
 * Immutable inputs of a report session besides the value map
 */
@Value
public class ReportContext {
    ActivityTree tree;
    ActivityMappings mappings;
    Quarter quarter;
    PreviousQuarterBalances previous;

    public static ReportContext create(ActivityTree tree, Quarter quarter, PreviousQuarterBalances previous) {
        return new ReportContext(tree, ActivityMappings.from(tree), quarter,
                previous == null ? PreviousQuarterBalances.none() : previous);
    }
}
