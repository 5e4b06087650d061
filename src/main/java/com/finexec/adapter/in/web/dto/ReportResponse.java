package com.finexec.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.finexec.application.port.in.ReportView;
import com.finexec.application.service.ValidationIssue;
import com.finexec.application.service.ValidationResult;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.BalanceSnapshot;
import com.finexec.domain.model.BalanceVerification;
import com.finexec.domain.model.ComputedValues;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.QuarterAmounts;
import com.finexec.domain.model.QuarterStatuses;
import com.finexec.domain.model.QuarterlyTotals;
import com.finexec.domain.model.ReportDraft;
import com.finexec.domain.model.StatementRow;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * DTO for a recomputed report: stored values, derived sections, statement table and validation state
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportResponse(
        String status,
        String reportId,
        String programType,
        String facilityType,
        String facilityId,
        int fiscalYear,
        String quarter,
        List<String> visibleQuarters,
        List<String> lockedQuarters,
        Map<String, ActivityValueResponse> activities,
        ComputedValuesResponse computedValues,
        BalancesResponse balances,
        List<StatementRowResponse> table,
        ValidationResponse validation,
        VerificationResponse verification,
        boolean canSubmit
) {

    public static ReportResponse from(ReportView view) {
        ReportDraft draft = view.draft();
        Map<String, ActivityValueResponse> activities = new LinkedHashMap<>();
        view.recalculation().state().asMap().forEach((code, value) -> activities.put(code, ActivityValueResponse.from(value)));

        return new ReportResponse(
                "success",
                draft.getReportId(),
                draft.getProgramType(),
                draft.getFacilityType(),
                draft.getFacilityId(),
                draft.getFiscalYear(),
                draft.getQuarter().getValue(),
                quarterNames(view.visibleQuarters()),
                quarterNames(view.lockedQuarters()),
                activities,
                ComputedValuesResponse.from(view.recalculation().computedValues()),
                BalancesResponse.from(view.recalculation().balances()),
                view.recalculation().table().stream().map(StatementRowResponse::from).collect(Collectors.toList()),
                ValidationResponse.from(view.validation()),
                view.verification() == null ? null : VerificationResponse.from(view.verification()),
                view.canSubmit()
        );
    }

    private static List<String> quarterNames(List<Quarter> quarters) {
        return quarters.stream().map(Quarter::getValue).collect(Collectors.toList());
    }

    public record TotalsResponse(
            BigDecimal q1,
            BigDecimal q2,
            BigDecimal q3,
            BigDecimal q4,
            BigDecimal cumulativeBalance
    ) {
        public static TotalsResponse from(QuarterlyTotals totals) {
            return new TotalsResponse(totals.getQ1(), totals.getQ2(), totals.getQ3(), totals.getQ4(),
                    totals.getCumulativeBalance());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ActivityValueResponse(
            Map<String, BigDecimal> amounts,
            String comment,
            Map<String, String> paymentStatus,
            Map<String, BigDecimal> amountPaid,
            Map<String, BigDecimal> netAmount,
            Map<String, BigDecimal> vatAmount,
            Map<String, BigDecimal> vatCleared,
            Map<String, BigDecimal> payableCleared,
            Map<String, BigDecimal> otherReceivableCleared,
            Map<String, BigDecimal> priorYearAdjustment
    ) {
        public static ActivityValueResponse from(ActivityValue value) {
            return new ActivityValueResponse(
                    quarterly(value.getAmounts()),
                    value.getComment(),
                    statuses(value.getPaymentStatus()),
                    quarterly(value.getAmountPaid()),
                    quarterly(value.getNetAmount()),
                    quarterly(value.getVatAmount()),
                    quarterly(value.getVatCleared()),
                    quarterly(value.getPayableCleared()),
                    quarterly(value.getOtherReceivableCleared()),
                    quarterly(value.getPriorYearAdjustment())
            );
        }

        private static Map<String, BigDecimal> quarterly(QuarterAmounts amounts) {
            Map<String, BigDecimal> result = new LinkedHashMap<>();
            for (Quarter quarter : Quarter.values()) {
                if (amounts.isReported(quarter)) {
                    result.put(quarter.key(), amounts.rawValue(quarter));
                }
            }
            return result;
        }

        private static Map<String, String> statuses(QuarterStatuses statuses) {
            Map<String, String> result = new LinkedHashMap<>();
            statuses.asMap().forEach((quarter, status) -> result.put(quarter.key(), status.getValue()));
            return result;
        }
    }

    public record ComputedValuesResponse(
            TotalsResponse receipts,
            TotalsResponse expenditures,
            TotalsResponse surplus,
            TotalsResponse financialAssets,
            TotalsResponse financialLiabilities,
            TotalsResponse netFinancialAssets,
            TotalsResponse closingBalance
    ) {
        public static ComputedValuesResponse from(ComputedValues values) {
            return new ComputedValuesResponse(
                    TotalsResponse.from(values.getReceipts()),
                    TotalsResponse.from(values.getExpenditures()),
                    TotalsResponse.from(values.getSurplus()),
                    TotalsResponse.from(values.getFinancialAssets()),
                    TotalsResponse.from(values.getFinancialLiabilities()),
                    TotalsResponse.from(values.getNetFinancialAssets()),
                    TotalsResponse.from(values.getClosingBalance())
            );
        }
    }

    public record BalancesResponse(
            BigDecimal openingCash,
            BigDecimal cashAtBank,
            BigDecimal otherReceivables,
            Map<String, BigDecimal> payables,
            Map<String, BigDecimal> vatReceivables
    ) {
        public static BalancesResponse from(BalanceSnapshot snapshot) {
            Map<String, BigDecimal> payables = new LinkedHashMap<>();
            snapshot.getPayables().forEach((code, position) -> payables.put(code, position.closing()));
            Map<String, BigDecimal> vat = new LinkedHashMap<>();
            snapshot.getVatReceivables().forEach((category, position) -> vat.put(category.getValue(), position.closing()));
            return new BalancesResponse(snapshot.getOpeningCash(), snapshot.getCashAtBank(),
                    snapshot.getOtherReceivables(), payables, vat);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record StatementRowResponse(
            String id,
            String title,
            String kind,
            @JsonProperty("isEditable") boolean isEditable,
            @JsonProperty("isCalculated") boolean isCalculated,
            TotalsResponse totals,
            List<StatementRowResponse> children
    ) {
        public static StatementRowResponse from(StatementRow row) {
            return new StatementRowResponse(
                    row.getId(),
                    row.getTitle(),
                    row.getKind().name().toLowerCase(),
                    row.isEditable(),
                    row.isCalculated(),
                    TotalsResponse.from(row.getTotals()),
                    row.getChildren().stream().map(StatementRowResponse::from).collect(Collectors.toList())
            );
        }
    }

    public record IssueResponse(String field, String message, String severity) {
        public static IssueResponse from(ValidationIssue issue) {
            return new IssueResponse(issue.field(), issue.message(), issue.severity().name().toLowerCase());
        }
    }

    public record ValidationResponse(
            @JsonProperty("isValid") boolean isValid,
            List<IssueResponse> errors,
            List<IssueResponse> warnings
    ) {
        public static ValidationResponse from(ValidationResult result) {
            return new ValidationResponse(
                    result.isValid(),
                    result.blocking().stream().map(IssueResponse::from).collect(Collectors.toList()),
                    result.warnings().stream().map(IssueResponse::from).collect(Collectors.toList())
            );
        }
    }

    public record VerificationResponse(
            @JsonProperty("isBalanced") boolean isBalanced,
            BigDecimal difference,
            BigDecimal netFinancialAssets,
            BigDecimal closingBalance,
            String source
    ) {
        public static VerificationResponse from(BalanceVerification verification) {
            return new VerificationResponse(
                    verification.balanced(),
                    verification.difference(),
                    verification.netFinancialAssets(),
                    verification.closingBalance(),
                    verification.source().name().toLowerCase()
            );
        }
    }
}
