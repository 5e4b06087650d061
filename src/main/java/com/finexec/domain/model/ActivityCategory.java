package com.finexec.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level section of the activity catalog
 */
@Value
@Builder
public class ActivityCategory {
    Section section;
    String label;
    int displayOrder;
    boolean computed;
    @Singular("item")
    List<Activity> items;
    @Singular("subCategory")
    List<ActivitySubCategory> subCategories;

    /**
     * Every line of the section, direct items first, then subcategory items
     */
    public List<Activity> allItems() {
        List<Activity> all = new ArrayList<>(items);
        for (ActivitySubCategory subCategory : subCategories) {
            all.addAll(subCategory.getItems());
        }
        return all;
    }
}
