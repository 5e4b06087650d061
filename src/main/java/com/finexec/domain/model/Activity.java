package com.finexec.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Leaf line item of the activity catalog
 * Value object - immutable configuration owned by the catalog collaborator
 */
@Value
@Builder(toBuilder = true)
public class Activity {
    String code;  // {PROJECT}_EXEC_{FACILITY}_{SECTION}_...
    String name;
    Section section;
    String subCategoryCode;  // nullable
    int displayOrder;
    ActivityType activityType;
    boolean editable;
    boolean computed;
    VatCategory vatCategory;  // nullable, only for VAT-applicable expenses
    String payableCode;  // nullable, explicit expense -> payable mapping
    @Builder.Default
    LineRole role = LineRole.NONE;

    public boolean isTotalRow() {
        return activityType == ActivityType.TOTAL_ROW;
    }

    /**
     * Whether the line feeds the aggregation (total rows are display anchors only)
     */
    public boolean isAggregationInput() {
        return !isTotalRow();
    }

    public boolean isVatApplicable() {
        return vatCategory != null;
    }

    public boolean isExpense() {
        return section == Section.B && !isTotalRow() && !computed;
    }

    public boolean isPayable() {
        return section == Section.E && !isTotalRow() && !computed;
    }

    public boolean isVatReceivable() {
        return activityType == ActivityType.VAT_RECEIVABLE;
    }

    public boolean hasRole(LineRole other) {
        return role == other;
    }

    /**
     * Whether a user may type an amount into this line directly
     */
    public boolean isUserEditable() {
        return editable && !computed
                && (activityType == ActivityType.REGULAR || activityType == ActivityType.MISCELLANEOUS_ADJUSTMENT);
    }
}
