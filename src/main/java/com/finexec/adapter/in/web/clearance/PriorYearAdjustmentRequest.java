package com.finexec.adapter.in.web.clearance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a prior-year adjustment; a missing target code means a cash adjustment
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PriorYearAdjustmentRequest(
        @JsonProperty("adjustmentCode") String adjustmentCode,
        @JsonProperty("targetCode") String targetCode,
        @JsonProperty("direction") String direction,
        @JsonProperty("amount") Object amount
) {}
