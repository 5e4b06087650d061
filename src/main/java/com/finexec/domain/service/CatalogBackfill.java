package com.finexec.domain.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityType;
import com.finexec.domain.model.LineRole;
import com.finexec.domain.model.Section;
import com.finexec.domain.model.VatCategory;

import java.util.Locale;

/**
 * Fills in the explicit fields (role, vatCategory, activity type of VAT receivables) for
 * catalog entries that predate them, using the historical name and code patterns.
 * Applied once when a catalog is loaded, never during recomputation.
 */
public final class CatalogBackfill {

    private static final String PRIOR_YEAR_SUBCATEGORY = "G-01";

    private CatalogBackfill() {
    }

    public static Activity apply(Activity activity) {
        Activity.ActivityBuilder builder = activity.toBuilder();
        if (activity.getRole() == null || activity.getRole() == LineRole.NONE) {
            builder.role(roleOf(activity));
        }
        if (activity.getVatCategory() == null && activity.isExpense()) {
            builder.vatCategory(VatCategoryMatcher.match(activity.getName()).orElse(null));
        }
        if (activity.getSection() == Section.D
                && activity.getActivityType() == ActivityType.REGULAR
                && VatCategory.isReceivableCode(activity.getCode())) {
            builder.activityType(ActivityType.VAT_RECEIVABLE);
        }
        return builder.build();
    }

    static LineRole roleOf(Activity activity) {
        String name = activity.getName() == null ? "" : activity.getName().toLowerCase(Locale.ROOT).trim();
        String code = activity.getCode() == null ? "" : activity.getCode();

        switch (activity.getSection()) {
            case D:
                if (name.contains("cash at bank") || code.endsWith("_D_1")) {
                    return LineRole.CASH_AT_BANK;
                }
                if (name.contains("other receivable") || code.endsWith("_D_D-01_5")) {
                    return LineRole.OTHER_RECEIVABLES;
                }
                return LineRole.NONE;
            case G:
                if (name.contains("accumulated") && (name.contains("surplus") || name.contains("deficit"))) {
                    return LineRole.ACCUMULATED_SURPLUS;
                }
                if (name.contains("of the period")) {
                    return LineRole.PERIOD_SURPLUS;
                }
                if (PRIOR_YEAR_SUBCATEGORY.equals(activity.getSubCategoryCode())) {
                    if (name.contains("cash")) {
                        return LineRole.PRIOR_YEAR_CASH;
                    }
                    if (name.contains("payable")) {
                        return LineRole.PRIOR_YEAR_PAYABLE;
                    }
                    if (name.contains("receivable")) {
                        return LineRole.PRIOR_YEAR_RECEIVABLE;
                    }
                }
                return LineRole.NONE;
            default:
                return LineRole.NONE;
        }
    }
}
