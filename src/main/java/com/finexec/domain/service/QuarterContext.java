package com.finexec.domain.service;

import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.ReportState;

import java.util.ArrayList;
import java.util.List;

/**
 * Which quarters of a report are editable, locked or worth showing.
 * Only the current quarter is editable; every other quarter is locked.
 */
public final class QuarterContext {

    private final Quarter current;

    private QuarterContext(Quarter current) {
        this.current = current;
    }

    public static QuarterContext of(Quarter current) {
        return new QuarterContext(current);
    }

    public Quarter getCurrent() {
        return current;
    }

    public boolean isEditable(Quarter quarter) {
        return quarter == current;
    }

    public boolean isLocked(Quarter quarter) {
        return !isEditable(quarter);
    }

    /**
     * Q1 through the current quarter
     */
    public List<Quarter> activeQuarters() {
        List<Quarter> active = new ArrayList<>();
        for (Quarter quarter : Quarter.values()) {
            if (!quarter.isAfter(current)) {
                active.add(quarter);
            }
        }
        return active;
    }

    public List<Quarter> lockedQuarters() {
        List<Quarter> locked = new ArrayList<>();
        for (Quarter quarter : Quarter.values()) {
            if (isLocked(quarter)) {
                locked.add(quarter);
            }
        }
        return locked;
    }

    /**
     * The current quarter, or any quarter where some activity reports a positive amount
     */
    public boolean isVisible(Quarter quarter, ReportState state) {
        if (quarter == current) {
            return true;
        }
        for (ActivityValue value : state.asMap().values()) {
            if (value.getAmounts().get(quarter).signum() > 0) {
                return true;
            }
        }
        return false;
    }

    public List<Quarter> visibleQuarters(ReportState state) {
        List<Quarter> visible = new ArrayList<>();
        for (Quarter quarter : Quarter.values()) {
            if (isVisible(quarter, state)) {
                visible.add(quarter);
            }
        }
        return visible;
    }
}
