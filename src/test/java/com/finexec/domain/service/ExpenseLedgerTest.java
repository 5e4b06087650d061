package com.finexec.domain.service;

import com.finexec.domain.ReportFixtures;
import com.finexec.domain.model.ActivityTree;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.ExpenseLine;
import com.finexec.domain.model.PaymentStatus;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.QuarterAmounts;
import com.finexec.domain.model.QuarterStatuses;
import com.finexec.domain.model.ReportState;
import com.finexec.domain.model.VatCategory;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.finexec.domain.ReportFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ExpenseLedgerTest {

    private final ActivityTree tree = ReportFixtures.tree();
    private final ExpenseLedger ledger = new ExpenseLedger(ActivityMappings.from(tree));

    private ExpenseLine line(ReportState state, String code) {
        return ledger.buildLedger(tree.expenses(), state, Quarter.Q1).stream()
                .filter(line -> line.getCode().equals(code))
                .findFirst()
                .orElseThrow();
    }

    private static ActivityValue expense(String amount, PaymentStatus status, String paid) {
        ActivityValue.ActivityValueBuilder builder = ActivityValue.builder()
                .amounts(QuarterAmounts.single(Quarter.Q1, bd(amount)));
        if (status != null) {
            builder.paymentStatus(QuarterStatuses.of(Map.of(Quarter.Q1, status)));
        }
        if (paid != null) {
            builder.amountPaid(QuarterAmounts.single(Quarter.Q1, bd(paid)));
        }
        return builder.build();
    }

    @Test
    void buildLedger_shouldSkipNonExpenseLines() {
        List<ExpenseLine> lines = ledger.buildLedger(tree.allLeaves(), ReportState.empty(), Quarter.Q1);

        assertEquals(5, lines.size());
    }

    @Test
    void paidExpense_shouldBeFullyPaid() {
        ReportState state = ReportState.of(Map.of(NURSE, expense("100", PaymentStatus.PAID, null)));

        ExpenseLine nurse = line(state, NURSE);

        assertEquals(0, bd("100").compareTo(nurse.getAmountPaid()));
        assertEquals(0, BigDecimal.ZERO.compareTo(nurse.unpaidPortion()));
        assertEquals(SALARIES_PAYABLE, nurse.getPayableCode());
    }

    @Test
    void expenseWithoutStatus_shouldDefaultToUnpaid() {
        ReportState state = ReportState.of(Map.of(NURSE, expense("100", null, null)));

        ExpenseLine nurse = line(state, NURSE);

        assertEquals(PaymentStatus.UNPAID, nurse.getPaymentStatus());
        assertEquals(0, bd("100").compareTo(nurse.unpaidPortion()));
    }

    @Test
    void partialPayment_shouldLeaveRemainderUnpaid() {
        ReportState state = ReportState.of(Map.of(NURSE, expense("100", PaymentStatus.PARTIAL, "30")));

        ExpenseLine nurse = line(state, NURSE);

        assertEquals(0, bd("30").compareTo(nurse.getAmountPaid()));
        assertEquals(0, bd("70").compareTo(nurse.unpaidPortion()));
    }

    @Test
    void zeroExpense_shouldBeUnpaidWhateverTheStatus() {
        ReportState state = ReportState.of(Map.of(NURSE, expense("0", PaymentStatus.PAID, null)));

        ExpenseLine nurse = line(state, NURSE);

        assertEquals(PaymentStatus.UNPAID, nurse.getPaymentStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(nurse.getAmountPaid()));
    }

    @Test
    void vatExpense_shouldAddVatToGross() {
        ActivityValue value = ActivityValue.builder()
                .amounts(QuarterAmounts.single(Quarter.Q1, bd("100")))
                .netAmount(QuarterAmounts.single(Quarter.Q1, bd("100")))
                .vatAmount(QuarterAmounts.single(Quarter.Q1, bd("18")))
                .build();

        ExpenseLine communication = line(ReportState.of(Map.of(COMMUNICATION, value)), COMMUNICATION);

        assertEquals(VatCategory.COMMUNICATION_ALL, communication.getVatCategory());
        assertEquals(0, bd("100").compareTo(communication.getNetAmount()));
        assertEquals(0, bd("118").compareTo(communication.getGrossAmount()));
    }

    @Test
    void vatExpenseWithoutSplit_shouldTreatAmountAsNet() {
        ReportState state = ReportState.of(Map.of(FUEL, expense("50", null, null)));

        ExpenseLine fuel = line(state, FUEL);

        assertTrue(fuel.isVatApplicable());
        assertEquals(0, bd("50").compareTo(fuel.getNetAmount()));
        assertEquals(0, BigDecimal.ZERO.compareTo(fuel.getVatAmount()));
        assertEquals(0, bd("50").compareTo(fuel.getGrossAmount()));
    }
}
