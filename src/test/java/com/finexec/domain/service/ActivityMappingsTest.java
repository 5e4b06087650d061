package com.finexec.domain.service;

import com.finexec.domain.ReportFixtures;
import com.finexec.domain.model.VatCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.finexec.domain.ReportFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ActivityMappingsTest {

    private final ActivityMappings mappings = ActivityMappings.from(ReportFixtures.tree());

    @Test
    void payableFor_shouldDeriveFromSubCategoryAndName() {
        assertEquals(Optional.of(SALARIES_PAYABLE), mappings.payableFor(NURSE));
        assertEquals(Optional.of(COMMUNICATION_PAYABLE), mappings.payableFor(COMMUNICATION));
        assertEquals(Optional.of(FUEL_PAYABLE), mappings.payableFor(FUEL));
    }

    @Test
    void payableFor_shouldBeEmptyForTransfers() {
        assertTrue(mappings.payableFor(TRANSFER).isEmpty());
        assertFalse(mappings.unmappedExpenses().contains(TRANSFER));
    }

    @Test
    void unmappedExpenses_shouldListExpensesWithoutPayableLine() {
        assertEquals(List.of(BANK_CHARGES), mappings.unmappedExpenses());
    }

    @Test
    void expensesFor_shouldInvertPayableMapping() {
        assertEquals(List.of(NURSE), mappings.expensesFor(SALARIES_PAYABLE));
        assertTrue(mappings.expensesFor("UNKNOWN").isEmpty());
    }

    @Test
    void specialLines_shouldBeResolvedByRole() {
        assertEquals(Optional.of(CASH), mappings.cashAtBankCode());
        assertEquals(Optional.of(OTHER_RECEIVABLES), mappings.otherReceivablesCode());
        assertEquals(Optional.of(PRIOR_YEAR_CASH), mappings.priorYearCashCode());
        assertEquals(Optional.of(VAT_FUEL), mappings.vatReceivableFor(VatCategory.FUEL));
        assertEquals(4, mappings.getVatReceivableCodes().size());
    }
}
