package com.finexec.adapter.in.web.clearance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a payable, VAT or other-receivable clearance
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClearanceRequest(
        @JsonProperty("clearanceType") String clearanceType,
        @JsonProperty("activityCode") String activityCode,
        @JsonProperty("amount") Object amount
) {}
