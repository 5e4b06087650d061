package com.finexec.adapter.in.web.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.QuarterAmounts;
import com.finexec.domain.service.Amounts;
import com.finexec.domain.service.LegacyValueNormalizer;

import java.math.BigDecimal;

/**
 * Stored value of one activity as sent by the client.
 * Quarter amounts come as q1..q4; payment fields may be a scalar (older drafts) or a q1..q4 map.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActivityValueRequest(
        @JsonProperty("q1") Object q1,
        @JsonProperty("q2") Object q2,
        @JsonProperty("q3") Object q3,
        @JsonProperty("q4") Object q4,
        @JsonProperty("comment") String comment,
        @JsonProperty("paymentStatus") Object paymentStatus,
        @JsonProperty("amountPaid") Object amountPaid,
        @JsonProperty("netAmount") Object netAmount,
        @JsonProperty("vatAmount") Object vatAmount,
        @JsonProperty("vatCleared") Object vatCleared,
        @JsonProperty("payableCleared") Object payableCleared,
        @JsonProperty("otherReceivableCleared") Object otherReceivableCleared,
        @JsonProperty("priorYearAdjustment") Object priorYearAdjustment
) {

    public ActivityValue toActivityValue() {
        return ActivityValue.builder()
                .amounts(quarterAmounts())
                .comment(comment)
                .paymentStatus(LegacyValueNormalizer.paymentStatus(paymentStatus))
                .amountPaid(LegacyValueNormalizer.amounts(amountPaid))
                .netAmount(LegacyValueNormalizer.amounts(netAmount))
                .vatAmount(LegacyValueNormalizer.amounts(vatAmount))
                .vatCleared(LegacyValueNormalizer.amounts(vatCleared))
                .payableCleared(LegacyValueNormalizer.amounts(payableCleared))
                .otherReceivableCleared(LegacyValueNormalizer.amounts(otherReceivableCleared))
                .priorYearAdjustment(LegacyValueNormalizer.amounts(priorYearAdjustment))
                .build();
    }

    private QuarterAmounts quarterAmounts() {
        QuarterAmounts amounts = QuarterAmounts.empty();
        Object[] raw = {q1, q2, q3, q4};
        for (Quarter quarter : Quarter.values()) {
            BigDecimal amount = Amounts.parse(raw[quarter.index()]);
            if (amount != null) {
                amounts = amounts.with(quarter, amount);
            }
        }
        return amounts;
    }
}
