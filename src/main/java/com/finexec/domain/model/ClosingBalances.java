package com.finexec.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;

/**
 * Closing position of a finalized quarter
 */
@Value
@Builder
public class ClosingBalances {
    @Builder.Default
    Map<String, BigDecimal> assets = Collections.emptyMap();  // Section D, by code
    @Builder.Default
    Map<String, BigDecimal> liabilities = Collections.emptyMap();  // Section E, by code
    @Builder.Default
    Map<String, BigDecimal> equity = Collections.emptyMap();  // Section G, by code
    Map<VatCategory, BigDecimal> vat;  // nullable for snapshots older than the VAT split
    BigDecimal closingBalanceTotal;  // nullable, cumulative Section G total

    public Map<String, BigDecimal> section(Section section) {
        if (section == Section.D) {
            return assets;
        }
        if (section == Section.E) {
            return liabilities;
        }
        if (section == Section.G) {
            return equity;
        }
        return Collections.emptyMap();
    }

    public boolean hasVatMap() {
        return vat != null && !vat.isEmpty();
    }
}
