package com.finexec.domain.service;

import com.finexec.domain.model.ClosingBalances;
import com.finexec.domain.model.PreviousQuarterBalances;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.Section;
import com.finexec.domain.model.VatCategory;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts opening balances from the previous quarter's closing snapshot.
 * Missing snapshots, sections or codes all yield a zero opening balance.
 * An exact code match takes precedence over its alias.
 */
public class RolloverResolver {

    private final CodeMappingTable codeMapping;

    public RolloverResolver(CodeMappingTable codeMapping) {
        this.codeMapping = codeMapping;
    }

    public BigDecimal openingBalance(Section section, String code, PreviousQuarterBalances previous) {
        if (code == null || previous == null || !previous.hasData()) {
            return BigDecimal.ZERO;
        }
        Map<String, BigDecimal> closing = previous.getClosingBalances().section(section);
        BigDecimal value = closing.get(code);
        if (value == null) {
            value = closing.get(codeMapping.resolve(code));
        }
        return value == null ? BigDecimal.ZERO : value;
    }

    public BigDecimal openingCash(String cashAtBankCode, PreviousQuarterBalances previous) {
        return openingBalance(Section.D, cashAtBankCode, previous);
    }

    /**
     * Entire previous Section E map, restricted to positive amounts and keyed by canonical code
     */
    public Map<String, BigDecimal> openingPayables(PreviousQuarterBalances previous) {
        if (previous == null || !previous.hasData()) {
            return Collections.emptyMap();
        }
        Map<String, BigDecimal> payables = new LinkedHashMap<>();
        previous.getClosingBalances().getLiabilities().forEach((code, amount) -> {
            if (Amounts.isPositive(amount)) {
                payables.merge(codeMapping.resolve(code), amount, BigDecimal::add);
            }
        });
        return payables;
    }

    /**
     * VAT openings from the dedicated VAT map, else reconstructed from Section D codes
     */
    public Map<VatCategory, BigDecimal> openingVat(PreviousQuarterBalances previous) {
        Map<VatCategory, BigDecimal> opening = new EnumMap<>(VatCategory.class);
        for (VatCategory category : VatCategory.values()) {
            opening.put(category, BigDecimal.ZERO);
        }
        if (previous == null || !previous.hasData()) {
            return opening;
        }
        ClosingBalances closing = previous.getClosingBalances();
        if (closing.hasVatMap()) {
            closing.getVat().forEach((category, amount) -> opening.put(category, Amounts.orZero(amount)));
            return opening;
        }
        closing.getAssets().forEach((code, amount) -> {
            String canonical = codeMapping.resolve(code);
            if (VatCategory.isReceivableCode(canonical)) {
                VatCategory.fromReceivableCode(canonical)
                        .ifPresent(category -> opening.merge(category, Amounts.orZero(amount), BigDecimal::add));
            }
        });
        return opening;
    }

    public BigDecimal openingOtherReceivables(String otherReceivablesCode, PreviousQuarterBalances previous) {
        return openingBalance(Section.D, otherReceivablesCode, previous);
    }

    /**
     * Value for the accumulated surplus line. A new fiscal year (Q1) starts from the prior year's
     * closing balance; later quarters carry the line over from the previous quarter.
     */
    public Optional<BigDecimal> accumulatedSurplusSeed(String accumulatedSurplusCode, Quarter quarter,
                                                       PreviousQuarterBalances previous) {
        if (previous == null || !previous.hasData()) {
            return Optional.empty();
        }
        ClosingBalances closing = previous.getClosingBalances();
        if (quarter == Quarter.Q1) {
            return Optional.ofNullable(closing.getClosingBalanceTotal());
        }
        Map<String, BigDecimal> equity = closing.getEquity();
        BigDecimal value = equity.get(accumulatedSurplusCode);
        if (value == null) {
            value = equity.get(codeMapping.resolve(accumulatedSurplusCode));
        }
        return Optional.ofNullable(value);
    }
}
