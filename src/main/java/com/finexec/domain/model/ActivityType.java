package com.finexec.domain.model;

/**
 * Classification of a catalog line item
 */
public enum ActivityType {
    REGULAR("REGULAR"),
    VAT_RECEIVABLE("VAT_RECEIVABLE"),
    COMPUTED_ASSET("COMPUTED_ASSET"),
    MISCELLANEOUS_ADJUSTMENT("MISCELLANEOUS_ADJUSTMENT"),
    TOTAL_ROW("TOTAL_ROW");

    private final String value;

    ActivityType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ActivityType fromValue(String value) {
        for (ActivityType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown activity type: " + value);
    }

    public static boolean isValid(String value) {
        for (ActivityType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
