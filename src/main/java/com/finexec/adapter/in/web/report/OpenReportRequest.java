package com.finexec.adapter.in.web.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * DTO for opening a report session
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenReportRequest(
        @JsonProperty("programType") String programType,
        @JsonProperty("facilityType") String facilityType,
        @JsonProperty("facilityId") String facilityId,
        @JsonProperty("fiscalYear") Integer fiscalYear,
        @JsonProperty("quarter") String quarter,
        @JsonProperty("values") Map<String, ActivityValueRequest> values,
        @JsonProperty("previousQuarterBalances") PreviousQuarterBalancesRequest previousQuarterBalances,
        @JsonProperty("plannedBudget") Object plannedBudget
) {}
