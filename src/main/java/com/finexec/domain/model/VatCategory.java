package com.finexec.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * The four recoverable VAT categories and their Section D receivable codes
 */
public enum VatCategory {
    COMMUNICATION_ALL("communication_all", "_D_VAT_COMMUNICATION_ALL", "VAT Receivable 1: Communication - All",
            List.of("_D_VAT_AIRTIME", "_D_VAT_INTERNET", "_D_D-01_1", "_D_4", "_D_5")),
    MAINTENANCE("maintenance", "_D_VAT_MAINTENANCE", "VAT Receivable 2: Maintenance",
            List.of("_D_VAT_INFRASTRUCTURE", "_D_D-01_2", "_D_6")),
    FUEL("fuel", "_D_VAT_FUEL", "VAT Receivable 3: Fuel",
            List.of("_D_D-01_3")),
    OFFICE_SUPPLIES("office_supplies", "_D_VAT_SUPPLIES", "VAT Receivable 4: Office supplies",
            List.of("_D_D-01_4", "_D_7"));

    private final String value;
    private final String receivableSuffix;
    private final String label;
    private final List<String> legacySuffixes;

    VatCategory(String value, String receivableSuffix, String label, List<String> legacySuffixes) {
        this.value = value;
        this.receivableSuffix = receivableSuffix;
        this.label = label;
        this.legacySuffixes = legacySuffixes;
    }

    public String getValue() {
        return value;
    }

    public String getReceivableSuffix() {
        return receivableSuffix;
    }

    public String getLabel() {
        return label;
    }

    public List<String> getLegacySuffixes() {
        return legacySuffixes;
    }

    /**
     * Receivable code for a code prefix such as {@code HIV_EXEC_HOSPITAL}
     */
    public String receivableCode(String prefix) {
        return prefix + receivableSuffix;
    }

    /**
     * Category of a VAT receivable code, accepting current and legacy code forms
     */
    public static Optional<VatCategory> fromReceivableCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (VatCategory category : values()) {
            if (code.endsWith(category.receivableSuffix)) {
                return Optional.of(category);
            }
        }
        for (VatCategory category : values()) {
            for (String legacy : category.legacySuffixes) {
                if (code.endsWith(legacy)) {
                    return Optional.of(category);
                }
            }
        }
        return Optional.empty();
    }

    public static boolean isReceivableCode(String code) {
        return code != null && (code.contains("_D_VAT_") || code.contains("_E_VAT_"));
    }

    public static VatCategory fromValue(String value) {
        for (VatCategory category : values()) {
            if (category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown VAT category: " + value);
    }

    public static boolean isValid(String value) {
        for (VatCategory category : values()) {
            if (category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
