package com.finexec.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Quarter-keyed payment status; immutable
 */
public final class QuarterStatuses {

    private static final QuarterStatuses EMPTY = new QuarterStatuses(new EnumMap<>(Quarter.class));

    private final EnumMap<Quarter, PaymentStatus> statuses;

    private QuarterStatuses(EnumMap<Quarter, PaymentStatus> statuses) {
        this.statuses = statuses;
    }

    public static QuarterStatuses empty() {
        return EMPTY;
    }

    public static QuarterStatuses of(Map<Quarter, PaymentStatus> statuses) {
        EnumMap<Quarter, PaymentStatus> copy = new EnumMap<>(Quarter.class);
        statuses.forEach((quarter, status) -> {
            if (status != null) {
                copy.put(quarter, status);
            }
        });
        return new QuarterStatuses(copy);
    }

    public Optional<PaymentStatus> get(Quarter quarter) {
        return Optional.ofNullable(statuses.get(quarter));
    }

    public QuarterStatuses with(Quarter quarter, PaymentStatus status) {
        EnumMap<Quarter, PaymentStatus> copy = new EnumMap<>(Quarter.class);
        copy.putAll(statuses);
        copy.put(quarter, Objects.requireNonNull(status, "status"));
        return new QuarterStatuses(copy);
    }

    public Map<Quarter, PaymentStatus> asMap() {
        return Collections.unmodifiableMap(statuses);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof QuarterStatuses && statuses.equals(((QuarterStatuses) o).statuses);
    }

    @Override
    public int hashCode() {
        return statuses.hashCode();
    }

    @Override
    public String toString() {
        return statuses.toString();
    }
}
