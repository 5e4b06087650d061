package com.finexec.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CodeMappingTableTest {

    private static final String PREFIX = "HIV_EXEC_HOSPITAL";

    private final CodeMappingTable table = CodeMappingTable.defaultTable();

    @Test
    void resolve_shouldMapSchemaCodesToCanonicalVatCodes() {
        assertEquals(PREFIX + "_D_VAT_COMMUNICATION_ALL", table.resolve(PREFIX + "_D_D-01_1"));
        assertEquals(PREFIX + "_D_VAT_FUEL", table.resolve(PREFIX + "_D_D-01_3"));
        assertEquals(PREFIX + "_D_VAT_SUPPLIES", table.resolve(PREFIX + "_D_7"));
    }

    @Test
    void resolve_shouldMapPerUtilityVatCodes() {
        assertEquals(PREFIX + "_D_VAT_COMMUNICATION_ALL", table.resolve(PREFIX + "_D_VAT_AIRTIME"));
        assertEquals(PREFIX + "_D_VAT_COMMUNICATION_ALL", table.resolve(PREFIX + "_D_VAT_INTERNET"));
        assertEquals(PREFIX + "_D_VAT_MAINTENANCE", table.resolve(PREFIX + "_D_VAT_INFRASTRUCTURE"));
    }

    @Test
    void resolve_shouldLeaveUnknownCodesUnchanged() {
        String code = PREFIX + "_B_B-04_1";

        assertEquals(code, table.resolve(code));
        assertFalse(table.isAlias(code));
        assertNull(table.resolve(null));
    }

    @Test
    void resolve_shouldPreferLongestSuffix() {
        CodeMappingTable custom = new CodeMappingTable(Map.of("_1", "_ONE", "_D_1", "_CASH"));

        assertEquals("P_CASH", custom.resolve("P_D_1"));
        assertEquals("P_E_ONE", custom.resolve("P_E_1"));
    }

    @Test
    void aliasesOf_shouldListLegacyForms() {
        List<String> aliases = table.aliasesOf(PREFIX + "_D_VAT_COMMUNICATION_ALL");

        assertTrue(aliases.contains(PREFIX + "_D_D-01_1"));
        assertTrue(aliases.contains(PREFIX + "_D_VAT_AIRTIME"));
        assertTrue(aliases.contains(PREFIX + "_D_4"));
        assertTrue(aliases.stream().allMatch(table::isAlias));
    }

    @Test
    void aliasesOf_shouldKeepSectionGLinesApart() {
        String accumulatedSurplus = PREFIX + "_G_1";
        String priorYearCash = PREFIX + "_G_G-01_1";

        assertTrue(table.aliasesOf(accumulatedSurplus).isEmpty());
        assertEquals(priorYearCash, table.resolve(priorYearCash));
        assertFalse(table.isAlias(priorYearCash));
    }
}
