package com.finexec.domain.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityType;
import com.finexec.domain.model.LineRole;
import com.finexec.domain.model.Section;
import com.finexec.domain.model.VatCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CatalogBackfillTest {

    private static Activity.ActivityBuilder line(String code, String name, Section section) {
        return Activity.builder().code(code).name(name).section(section).activityType(ActivityType.REGULAR);
    }

    @Test
    void apply_shouldAssignRolesFromNames() {
        assertEquals(LineRole.CASH_AT_BANK,
                CatalogBackfill.apply(line("P_D_9", "Cash at bank", Section.D).build()).getRole());
        assertEquals(LineRole.OTHER_RECEIVABLES,
                CatalogBackfill.apply(line("P_D_D-01_5", "Receivables", Section.D).build()).getRole());
        assertEquals(LineRole.ACCUMULATED_SURPLUS,
                CatalogBackfill.apply(line("P_G_1", "Accumulated Surplus/Deficit", Section.G).build()).getRole());
        assertEquals(LineRole.PERIOD_SURPLUS,
                CatalogBackfill.apply(line("P_G_4", "Surplus/Deficit of the Period", Section.G).build()).getRole());
        assertEquals(LineRole.PRIOR_YEAR_PAYABLE, CatalogBackfill.apply(
                line("P_G_G-01_2", "Payable", Section.G).subCategoryCode("G-01").build()).getRole());
    }

    @Test
    void apply_shouldKeepExplicitRole() {
        Activity activity = line("P_D_1", "Bank", Section.D).role(LineRole.OTHER_RECEIVABLES).build();

        assertEquals(LineRole.OTHER_RECEIVABLES, CatalogBackfill.apply(activity).getRole());
    }

    @Test
    void apply_shouldDetectVatCategoryOfExpensesOnly() {
        Activity expense = CatalogBackfill.apply(line("P_B_B-04_3", "Fuel", Section.B).build());
        Activity payable = CatalogBackfill.apply(line("P_E_14", "Fuel", Section.E).build());

        assertEquals(VatCategory.FUEL, expense.getVatCategory());
        assertNull(payable.getVatCategory());
    }

    @Test
    void apply_shouldMarkVatCodesAsReceivables() {
        Activity receivable = CatalogBackfill.apply(line("P_D_VAT_FUEL", "VAT Receivable 3: Fuel", Section.D).build());

        assertEquals(ActivityType.VAT_RECEIVABLE, receivable.getActivityType());
        assertTrue(receivable.isVatReceivable());
    }
}
