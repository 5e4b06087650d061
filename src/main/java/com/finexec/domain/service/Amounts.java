package com.finexec.domain.service;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Lenient numeric parsing for user and collaborator input.
 * Unparsable or non-finite input becomes zero instead of failing.
 */
@Slf4j
public final class Amounts {

    private Amounts() {
    }

    /**
     * Parse a raw JSON value; {@code null} or blank input stays {@code null} (not reported)
     */
    public static BigDecimal parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof BigDecimal) {
            return (BigDecimal) raw;
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : BigDecimal.ZERO;
        }
        if (raw instanceof Number) {
            return new BigDecimal(raw.toString());
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            log.debug("Unparsable amount '{}', using 0", text);
            return BigDecimal.ZERO;
        }
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
