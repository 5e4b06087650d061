package com.finexec.domain.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.ExpenseLine;
import com.finexec.domain.model.PaymentStatus;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.ReportState;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes expenditure lines into gross, net, VAT and payment figures for one quarter.
 * Pure transform over the report state.
 */
public class ExpenseLedger {

    private final ActivityMappings mappings;

    public ExpenseLedger(ActivityMappings mappings) {
        this.mappings = mappings;
    }

    public List<ExpenseLine> buildLedger(List<Activity> expenseActivities, ReportState state, Quarter quarter) {
        List<ExpenseLine> lines = new ArrayList<>();
        for (Activity activity : expenseActivities) {
            if (!activity.isExpense()) {
                continue;
            }
            lines.add(toLine(activity, state.value(activity.getCode()), quarter));
        }
        return lines;
    }

    private ExpenseLine toLine(Activity activity, ActivityValue value, Quarter quarter) {
        BigDecimal net;
        BigDecimal vat;
        if (activity.isVatApplicable() && value.getNetAmount().isReported(quarter)) {
            net = value.getNetAmount().get(quarter);
            vat = value.getVatAmount().get(quarter);
        } else if (activity.isVatApplicable()) {
            // amount typed without a net/VAT split
            net = value.getAmounts().get(quarter);
            vat = value.getVatAmount().get(quarter);
        } else {
            net = value.getAmounts().get(quarter);
            vat = BigDecimal.ZERO;
        }
        BigDecimal gross = net.add(vat);

        PaymentStatus status = gross.signum() > 0
                ? value.getPaymentStatus().get(quarter).orElse(PaymentStatus.UNPAID)
                : PaymentStatus.UNPAID;

        return ExpenseLine.builder()
                .code(activity.getCode())
                .name(activity.getName())
                .payableCode(mappings.payableFor(activity.getCode()).orElse(null))
                .vatCategory(activity.getVatCategory())
                .grossAmount(gross)
                .netAmount(net)
                .vatAmount(vat)
                .vatCleared(value.getVatCleared().get(quarter))
                .paymentStatus(status)
                .amountPaid(amountPaid(status, gross, value, quarter))
                .build();
    }

    private BigDecimal amountPaid(PaymentStatus status, BigDecimal gross, ActivityValue value, Quarter quarter) {
        switch (status) {
            case PAID:
                return gross;
            case PARTIAL:
                // recorded as entered; the validator flags amounts above the invoice
                return value.getAmountPaid().get(quarter);
            default:
                return BigDecimal.ZERO;
        }
    }
}
