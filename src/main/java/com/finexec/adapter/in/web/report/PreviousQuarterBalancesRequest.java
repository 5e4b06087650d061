package com.finexec.adapter.in.web.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.finexec.domain.model.ClosingBalances;
import com.finexec.domain.model.PreviousQuarterBalances;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.VatCategory;
import com.finexec.domain.service.Amounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Previous quarter's closing snapshot supplied inline by the client
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PreviousQuarterBalancesRequest(
        @JsonProperty("exists") boolean exists,
        @JsonProperty("quarter") String quarter,
        @JsonProperty("closingBalances") ClosingBalancesRequest closingBalances
) {

    public PreviousQuarterBalances toPreviousQuarterBalances() {
        if (!exists || closingBalances == null || quarter == null || !Quarter.isValid(quarter)) {
            return PreviousQuarterBalances.none();
        }
        return PreviousQuarterBalances.of(Quarter.fromValue(quarter), closingBalances.toClosingBalances());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClosingBalancesRequest(
            @JsonProperty("D") Map<String, Object> assets,
            @JsonProperty("E") Map<String, Object> liabilities,
            @JsonProperty("G") Map<String, Object> equity,
            @JsonProperty("VAT") Map<String, Object> vat,
            @JsonProperty("closingBalance") Object closingBalance
    ) {

        private static final Logger log = LoggerFactory.getLogger(ClosingBalancesRequest.class);

        public ClosingBalances toClosingBalances() {
            return ClosingBalances.builder()
                    .assets(amounts(assets))
                    .liabilities(amounts(liabilities))
                    .equity(amounts(equity))
                    .vat(vatAmounts())
                    .closingBalanceTotal(Amounts.parse(closingBalance))
                    .build();
        }

        private static Map<String, BigDecimal> amounts(Map<String, Object> raw) {
            Map<String, BigDecimal> result = new LinkedHashMap<>();
            if (raw != null) {
                raw.forEach((code, value) -> result.put(code, Amounts.orZero(Amounts.parse(value))));
            }
            return result;
        }

        private Map<VatCategory, BigDecimal> vatAmounts() {
            if (vat == null) {
                return null;
            }
            Map<VatCategory, BigDecimal> result = new EnumMap<>(VatCategory.class);
            vat.forEach((category, value) -> {
                if (!VatCategory.isValid(category)) {
                    log.warn("Skipping unknown VAT category {} in closing balances", category);
                    return;
                }
                result.put(VatCategory.fromValue(category), Amounts.orZero(Amounts.parse(value)));
            });
            return result;
        }
    }
}
