package com.finexec.domain.service;

import com.finexec.domain.model.PaymentStatus;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.QuarterAmounts;
import com.finexec.domain.model.QuarterStatuses;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Converts the two historical shapes of payment data into quarter-keyed values.
 * A scalar applies to every quarter; a map is keyed by "q1".."q4".
 * Nothing past this boundary sees the scalar form.
 */
@Slf4j
public final class LegacyValueNormalizer {

    private LegacyValueNormalizer() {
    }

    public static QuarterStatuses paymentStatus(Object raw) {
        if (raw == null) {
            return QuarterStatuses.empty();
        }
        Map<Quarter, PaymentStatus> statuses = new EnumMap<>(Quarter.class);
        if (raw instanceof Map) {
            ((Map<?, ?>) raw).forEach((key, value) -> {
                Quarter quarter = quarterOf(key);
                PaymentStatus status = statusOf(value);
                if (quarter != null && status != null) {
                    statuses.put(quarter, status);
                }
            });
        } else {
            PaymentStatus status = statusOf(raw);
            if (status != null) {
                for (Quarter quarter : Quarter.values()) {
                    statuses.put(quarter, status);
                }
            }
        }
        return QuarterStatuses.of(statuses);
    }

    public static QuarterAmounts amounts(Object raw) {
        if (raw == null) {
            return QuarterAmounts.empty();
        }
        QuarterAmounts amounts = QuarterAmounts.empty();
        if (raw instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
                Quarter quarter = quarterOf(entry.getKey());
                BigDecimal amount = Amounts.parse(entry.getValue());
                if (quarter != null && amount != null) {
                    amounts = amounts.with(quarter, amount);
                }
            }
            return amounts;
        }
        BigDecimal amount = Amounts.parse(raw);
        if (amount == null) {
            return amounts;
        }
        for (Quarter quarter : Quarter.values()) {
            amounts = amounts.with(quarter, amount);
        }
        return amounts;
    }

    private static Quarter quarterOf(Object key) {
        if (key == null || !Quarter.isValid(key.toString())) {
            log.debug("Ignoring unknown quarter key '{}'", key);
            return null;
        }
        return Quarter.fromValue(key.toString());
    }

    private static PaymentStatus statusOf(Object value) {
        if (value == null || !PaymentStatus.isValid(value.toString())) {
            log.debug("Ignoring unknown payment status '{}'", value);
            return null;
        }
        return PaymentStatus.fromValue(value.toString());
    }
}
