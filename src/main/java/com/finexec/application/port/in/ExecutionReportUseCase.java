package com.finexec.application.port.in;

import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.ClosingBalances;
import com.finexec.domain.model.MiscellaneousAdjustmentCheck;
import com.finexec.domain.model.PreviousQuarterBalances;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Input port for editing and recomputing quarterly execution reports.
 * Every mutation recomputes the whole report before its future completes.
 */
public interface ExecutionReportUseCase {

    Future<ReportView> openReport(OpenReportCommand command);

    Future<ReportView> getReport(String reportId);

    Future<ReportView> updateAmount(UpdateAmountCommand command);

    Future<ReportView> updateComment(UpdateCommentCommand command);

    Future<ReportView> recordPayment(RecordPaymentCommand command);

    Future<ReportView> recordVatExpense(RecordVatExpenseCommand command);

    /**
     * Post a payable, VAT or other-receivable clearance together with its cash movement
     */
    Future<ReportView> clear(ClearanceCommand command);

    /**
     * Post a prior-year adjustment; without a target code it is a cash adjustment
     */
    Future<ReportView> applyPriorYearAdjustment(PriorYearAdjustmentCommand command);

    Future<MiscellaneousAdjustmentCheck> checkMiscellaneousAdjustment(String reportId, BigDecimal amount);

    /**
     * Compute the report's closing snapshot and store it for the next quarter's rollover; the report session ends
     */
    Future<ClosingBalances> publishClosingBalances(String reportId);

    /**
     * Command object for opening a report session
     */
    record OpenReportCommand(
            String programType,
            String facilityType,
            String facilityId,
            Integer fiscalYear,  // null: fiscal year of today
            String quarter,  // null: quarter of today
            Map<String, ActivityValue> values,
            PreviousQuarterBalances previousQuarterBalances,  // null: ask the provider
            BigDecimal plannedBudget  // null: ask the provider
    ) {}

    record UpdateAmountCommand(String reportId, String activityCode, BigDecimal amount) {}

    record UpdateCommentCommand(String reportId, String activityCode, String comment) {}

    record RecordPaymentCommand(String reportId, String activityCode, String paymentStatus, BigDecimal amountPaid) {}

    record RecordVatExpenseCommand(String reportId, String activityCode, BigDecimal netAmount, BigDecimal vatAmount) {}

    record ClearanceCommand(String reportId, String clearanceType, String activityCode, BigDecimal amount) {}

    record PriorYearAdjustmentCommand(
            String reportId,
            String adjustmentCode,
            String targetCode,
            String direction,
            BigDecimal amount
    ) {}
}
