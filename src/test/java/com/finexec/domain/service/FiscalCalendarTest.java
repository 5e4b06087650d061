package com.finexec.domain.service;

import com.finexec.domain.model.Quarter;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class FiscalCalendarTest {

    @Test
    void quarterOf_shouldFollowJulyToJuneYear() {
        assertEquals(Quarter.Q1, FiscalCalendar.quarterOf(LocalDate.of(2025, 7, 1)));
        assertEquals(Quarter.Q1, FiscalCalendar.quarterOf(LocalDate.of(2025, 9, 30)));
        assertEquals(Quarter.Q2, FiscalCalendar.quarterOf(LocalDate.of(2025, 12, 31)));
        assertEquals(Quarter.Q3, FiscalCalendar.quarterOf(LocalDate.of(2026, 1, 1)));
        assertEquals(Quarter.Q4, FiscalCalendar.quarterOf(LocalDate.of(2026, 6, 30)));
    }

    @Test
    void fiscalYear_shouldStartInJuly() {
        assertEquals(2025, FiscalCalendar.fiscalYear(LocalDate.of(2025, 7, 1)));
        assertEquals(2025, FiscalCalendar.fiscalYear(LocalDate.of(2026, 6, 30)));
    }

    @Test
    void currentQuarter_shouldUseClock() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-15T10:00:00Z"), ZoneOffset.UTC);

        assertEquals(Quarter.Q3, FiscalCalendar.currentQuarter(clock));
    }
}
