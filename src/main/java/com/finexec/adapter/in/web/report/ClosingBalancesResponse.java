package com.finexec.adapter.in.web.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.finexec.domain.model.ClosingBalances;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published closing snapshot, in the same shape accepted as previous-quarter balances
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClosingBalancesResponse(
        String status,
        String reportId,
        @JsonProperty("D") Map<String, BigDecimal> assets,
        @JsonProperty("E") Map<String, BigDecimal> liabilities,
        @JsonProperty("G") Map<String, BigDecimal> equity,
        @JsonProperty("VAT") Map<String, BigDecimal> vat,
        BigDecimal closingBalance
) {
    public static ClosingBalancesResponse from(String reportId, ClosingBalances balances) {
        Map<String, BigDecimal> vat = null;
        if (balances.getVat() != null) {
            Map<String, BigDecimal> byValue = new LinkedHashMap<>();
            balances.getVat().forEach((category, amount) -> byValue.put(category.getValue(), amount));
            vat = byValue;
        }
        return new ClosingBalancesResponse("success", reportId, balances.getAssets(), balances.getLiabilities(),
                balances.getEquity(), vat, balances.getClosingBalanceTotal());
    }
}
