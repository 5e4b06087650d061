package com.finexec.domain.model;

/**
 * Kind of manual clearance posted against a balance line
 */
public enum ClearanceType {
    PAYABLE("payable"),
    VAT("vat"),
    OTHER_RECEIVABLE("other_receivable");

    private final String value;

    ClearanceType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ClearanceType fromValue(String value) {
        for (ClearanceType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown clearance type: " + value);
    }

    public static boolean isValid(String value) {
        for (ClearanceType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
