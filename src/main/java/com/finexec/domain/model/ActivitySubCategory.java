package com.finexec.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Subcategory grouping inside a section, e.g. B-01 Human Resources
 */
@Value
@Builder
public class ActivitySubCategory {
    String code;
    String label;
    int displayOrder;
    @Singular("item")
    List<Activity> items;
}
