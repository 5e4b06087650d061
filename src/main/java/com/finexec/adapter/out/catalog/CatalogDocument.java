package com.finexec.adapter.out.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of a catalog resource:
 * {@code { programType, facilityType, sections: { A: { label, displayOrder, isComputed, items, subCategories } } }}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogDocument(
        @JsonProperty("programType") String programType,
        @JsonProperty("facilityType") String facilityType,
        @JsonProperty("sections") Map<String, SectionNode> sections
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SectionNode(
            @JsonProperty("label") String label,
            @JsonProperty("displayOrder") int displayOrder,
            @JsonProperty("isComputed") boolean computed,
            @JsonProperty("items") List<ItemNode> items,
            @JsonProperty("subCategories") Map<String, SubCategoryNode> subCategories
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SubCategoryNode(
            @JsonProperty("label") String label,
            @JsonProperty("displayOrder") int displayOrder,
            @JsonProperty("items") List<ItemNode> items
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ItemNode(
            @JsonProperty("code") String code,
            @JsonProperty("name") String name,
            @JsonProperty("displayOrder") int displayOrder,
            @JsonProperty("activityType") String activityType,
            @JsonProperty("isEditable") Boolean editable,
            @JsonProperty("isComputed") boolean computed,
            @JsonProperty("isTotalRow") boolean totalRow,
            @JsonProperty("vatCategory") String vatCategory,
            @JsonProperty("payableCode") String payableCode,
            @JsonProperty("role") String role
    ) {}
}
