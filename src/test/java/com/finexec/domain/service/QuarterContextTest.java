package com.finexec.domain.service;

import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.ReportState;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuarterContextTest {

    @Test
    void onlyCurrentQuarter_shouldBeEditable() {
        QuarterContext context = QuarterContext.of(Quarter.Q3);

        assertTrue(context.isEditable(Quarter.Q3));
        assertTrue(context.isLocked(Quarter.Q1));
        assertTrue(context.isLocked(Quarter.Q4));
        assertEquals(List.of(Quarter.Q1, Quarter.Q2, Quarter.Q4), context.lockedQuarters());
        assertEquals(List.of(Quarter.Q1, Quarter.Q2, Quarter.Q3), context.activeQuarters());
    }

    @Test
    void visibleQuarters_shouldIncludeQuartersWithPositiveData() {
        ReportState state = ReportState.empty()
                .update("A", value -> value.withAmount(Quarter.Q1, new BigDecimal("10")))
                .update("B", value -> value.withAmount(Quarter.Q2, new BigDecimal("-5")));

        List<Quarter> visible = QuarterContext.of(Quarter.Q3).visibleQuarters(state);

        assertEquals(List.of(Quarter.Q1, Quarter.Q3), visible);
    }

    @Test
    void emptyReport_shouldShowCurrentQuarterOnly() {
        assertEquals(List.of(Quarter.Q1), QuarterContext.of(Quarter.Q1).visibleQuarters(ReportState.empty()));
    }
}
