package com.finexec.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Static catalog of line items for one (program, facility type) pair.
 * Read-only for the lifetime of a report session.
 */
public final class ActivityTree {

    private final String programType;
    private final String facilityType;
    private final Map<Section, ActivityCategory> categories;
    private final Map<String, Activity> byCode;

    public ActivityTree(String programType, String facilityType, Map<Section, ActivityCategory> categories) {
        this.programType = programType;
        this.facilityType = facilityType;
        Map<Section, ActivityCategory> copy = new EnumMap<>(Section.class);
        copy.putAll(categories);
        this.categories = Collections.unmodifiableMap(copy);
        this.byCode = this.categories.values().stream()
                .flatMap(category -> category.allItems().stream())
                .collect(Collectors.toUnmodifiableMap(Activity::getCode, activity -> activity, (a, b) -> {
                    throw new IllegalArgumentException("Duplicate activity code: " + a.getCode());
                }));
    }

    public String getProgramType() {
        return programType;
    }

    public String getFacilityType() {
        return facilityType;
    }

    public Map<Section, ActivityCategory> getCategories() {
        return categories;
    }

    public Optional<ActivityCategory> category(Section section) {
        return Optional.ofNullable(categories.get(section));
    }

    public Optional<Activity> find(String code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public boolean contains(String code) {
        return byCode.containsKey(code);
    }

    /**
     * Aggregation-input lines of a section (total rows excluded)
     */
    public List<Activity> leaves(Section section) {
        return category(section)
                .map(category -> category.allItems().stream()
                        .filter(Activity::isAggregationInput)
                        .collect(Collectors.toList()))
                .orElse(Collections.emptyList());
    }

    public List<Activity> leaves(Section section, Predicate<Activity> filter) {
        return leaves(section).stream().filter(filter).collect(Collectors.toList());
    }

    public List<Activity> allLeaves() {
        return categories.keySet().stream()
                .flatMap(section -> leaves(section).stream())
                .collect(Collectors.toList());
    }

    public Optional<Activity> findByRole(LineRole role) {
        return allLeaves().stream().filter(activity -> activity.hasRole(role)).findFirst();
    }

    public List<Activity> expenses() {
        return leaves(Section.B, Activity::isExpense);
    }

    public List<Activity> payables() {
        return leaves(Section.E, Activity::isPayable);
    }

    public List<Activity> vatReceivables() {
        return leaves(Section.D, Activity::isVatReceivable);
    }
}
