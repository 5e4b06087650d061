package com.finexec.application.port.in;

import com.finexec.application.service.ValidationResult;
import com.finexec.domain.model.BalanceVerification;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.Recalculation;
import com.finexec.domain.model.ReportDraft;

import java.util.List;

/**
 * Everything the presentation layer needs after a recomputation
 */
public record ReportView(
        ReportDraft draft,
        Recalculation recalculation,
        ValidationResult validation,
        BalanceVerification verification,  // nullable until the first verification settles
        List<Quarter> visibleQuarters,
        List<Quarter> lockedQuarters
) {
    public boolean canSubmit() {
        return validation.isValid();
    }
}
