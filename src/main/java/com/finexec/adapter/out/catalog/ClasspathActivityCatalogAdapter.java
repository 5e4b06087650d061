package com.finexec.adapter.out.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finexec.application.port.out.ActivityCatalogProvider;
import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityCategory;
import com.finexec.domain.model.ActivitySubCategory;
import com.finexec.domain.model.ActivityTree;
import com.finexec.domain.model.ActivityType;
import com.finexec.domain.model.LineRole;
import com.finexec.domain.model.Section;
import com.finexec.domain.model.VatCategory;
import com.finexec.domain.service.CatalogBackfill;
import com.finexec.domain.service.VatCategoryMatcher;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Activity catalog read from classpath JSON resources named
 * {@code {directory}/{PROGRAM}_{facilitytype}.json}.
 * Trees are loaded once per (program, facility type) and cached.
 */
@Slf4j
public class ClasspathActivityCatalogAdapter implements ActivityCatalogProvider {

    private final Vertx vertx;
    private final String directory;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, ActivityTree> cache = new ConcurrentHashMap<>();

    public ClasspathActivityCatalogAdapter(Vertx vertx, String directory) {
        this.vertx = vertx;
        this.directory = directory;
    }

    @Override
    public Future<ActivityTree> fetchActivityTree(String programType, String facilityType) {
        String resource = resourceName(programType, facilityType);
        ActivityTree cached = cache.get(resource);
        if (cached != null) {
            return Future.succeededFuture(cached);
        }
        return vertx.executeBlocking(() -> load(resource))
                .onSuccess(tree -> {
                    cache.putIfAbsent(resource, tree);
                    log.info("Loaded activity catalog {} ({} lines)", resource, tree.allLeaves().size());
                })
                .onFailure(error -> log.error("Failed to load activity catalog {}: {}", resource, error.getMessage()));
    }

    ActivityTree load(String resource) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("No activity catalog found: " + resource);
            }
            return toTree(objectMapper.readValue(is, CatalogDocument.class));
        }
    }

    private ActivityTree toTree(CatalogDocument document) {
        Map<Section, ActivityCategory> categories = new EnumMap<>(Section.class);
        document.sections().forEach((sectionCode, node) -> {
            Section section = Section.fromValue(sectionCode);
            ActivityCategory.ActivityCategoryBuilder category = ActivityCategory.builder()
                    .section(section)
                    .label(node.label())
                    .displayOrder(node.displayOrder())
                    .computed(node.computed())
                    .items(toActivities(section, null, node.items()));
            if (node.subCategories() != null) {
                node.subCategories().forEach((code, sub) -> category.subCategory(ActivitySubCategory.builder()
                        .code(code)
                        .label(sub.label())
                        .displayOrder(sub.displayOrder())
                        .items(toActivities(section, code, sub.items()))
                        .build()));
            }
            categories.put(section, category.build());
        });
        return new ActivityTree(document.programType(), document.facilityType(), categories);
    }

    private List<Activity> toActivities(Section section, String subCategoryCode, List<CatalogDocument.ItemNode> items) {
        if (items == null) {
            return Collections.emptyList();
        }
        List<Activity> activities = new ArrayList<>();
        for (CatalogDocument.ItemNode item : items) {
            ActivityType type = item.totalRow()
                    ? ActivityType.TOTAL_ROW
                    : item.activityType() == null ? ActivityType.REGULAR : ActivityType.fromValue(item.activityType());
            boolean editable = item.editable() != null
                    ? item.editable()
                    : !item.computed() && (type == ActivityType.REGULAR || type == ActivityType.MISCELLANEOUS_ADJUSTMENT);

            Activity activity = Activity.builder()
                    .code(item.code())
                    .name(item.name())
                    .section(section)
                    .subCategoryCode(subCategoryCode)
                    .displayOrder(item.displayOrder())
                    .activityType(type)
                    .editable(editable)
                    .computed(item.computed())
                    .vatCategory(item.vatCategory() == null ? null : VatCategory.fromValue(item.vatCategory()))
                    .payableCode(item.payableCode())
                    .role(item.role() == null ? LineRole.NONE : LineRole.valueOf(item.role().toUpperCase(Locale.ROOT)))
                    .build();

            if (activity.isExpense() && activity.getVatCategory() == null && VatCategoryMatcher.isAmbiguous(item.name())) {
                log.warn("Expense '{}' ({}) matches several VAT categories {}; using the first",
                        item.name(), item.code(), VatCategoryMatcher.allMatches(item.name()));
            }
            activities.add(CatalogBackfill.apply(activity));
        }
        return activities;
    }

    private String resourceName(String programType, String facilityType) {
        return directory + "/" + programType.toUpperCase(Locale.ROOT) + "_"
                + facilityType.toLowerCase(Locale.ROOT).replace(' ', '_') + ".json";
    }
}
