package com.finexec.domain.service;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityTree;
import com.finexec.domain.model.LineRole;
import com.finexec.domain.model.VatCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static lookup tables derived once from an activity tree:
 * expense to payable, VAT category to Section D receivable, and the special balance lines.
 */
public final class ActivityMappings {

    private static final String TRANSFERS_SUBCATEGORY = "B-05";

    private final Map<String, String> expenseToPayable;
    private final Map<VatCategory, String> vatReceivableCodes;
    private final String cashAtBankCode;
    private final String otherReceivablesCode;
    private final String priorYearCashCode;
    private final List<String> unmappedExpenses;

    private ActivityMappings(Map<String, String> expenseToPayable,
                             Map<VatCategory, String> vatReceivableCodes,
                             String cashAtBankCode,
                             String otherReceivablesCode,
                             String priorYearCashCode,
                             List<String> unmappedExpenses) {
        this.expenseToPayable = Collections.unmodifiableMap(expenseToPayable);
        this.vatReceivableCodes = Collections.unmodifiableMap(vatReceivableCodes);
        this.cashAtBankCode = cashAtBankCode;
        this.otherReceivablesCode = otherReceivablesCode;
        this.priorYearCashCode = priorYearCashCode;
        this.unmappedExpenses = Collections.unmodifiableList(unmappedExpenses);
    }

    public static ActivityMappings from(ActivityTree tree) {
        Map<String, String> payablesByName = new LinkedHashMap<>();
        for (Activity payable : tree.payables()) {
            payablesByName.put(payable.getName().toLowerCase(Locale.ROOT), payable.getCode());
        }

        Map<String, String> expenseToPayable = new LinkedHashMap<>();
        List<String> unmapped = new ArrayList<>();
        for (Activity expense : tree.expenses()) {
            String payableCode = expense.getPayableCode() != null
                    ? expense.getPayableCode()
                    : derivePayableCode(expense, payablesByName);
            expenseToPayable.put(expense.getCode(), payableCode);
            if (payableCode == null && !TRANSFERS_SUBCATEGORY.equals(expense.getSubCategoryCode())) {
                unmapped.add(expense.getCode());
            }
        }

        Map<VatCategory, String> vatCodes = new EnumMap<>(VatCategory.class);
        for (Activity receivable : tree.vatReceivables()) {
            VatCategory.fromReceivableCode(receivable.getCode())
                    .ifPresent(category -> vatCodes.putIfAbsent(category, receivable.getCode()));
        }

        return new ActivityMappings(
                expenseToPayable,
                vatCodes,
                tree.findByRole(LineRole.CASH_AT_BANK).map(Activity::getCode).orElse(null),
                tree.findByRole(LineRole.OTHER_RECEIVABLES).map(Activity::getCode).orElse(null),
                tree.findByRole(LineRole.PRIOR_YEAR_CASH).map(Activity::getCode).orElse(null),
                unmapped
        );
    }

    /**
     * Payable line for an expense; empty for transfers and unmapped expenses
     */
    public Optional<String> payableFor(String expenseCode) {
        return Optional.ofNullable(expenseToPayable.get(expenseCode));
    }

    public List<String> expensesFor(String payableCode) {
        List<String> expenses = new ArrayList<>();
        expenseToPayable.forEach((expense, payable) -> {
            if (payableCode.equals(payable)) {
                expenses.add(expense);
            }
        });
        return expenses;
    }

    public Optional<String> vatReceivableFor(VatCategory category) {
        return Optional.ofNullable(vatReceivableCodes.get(category));
    }

    public Map<String, String> getExpenseToPayable() {
        return expenseToPayable;
    }

    public Map<VatCategory, String> getVatReceivableCodes() {
        return vatReceivableCodes;
    }

    public Optional<String> cashAtBankCode() {
        return Optional.ofNullable(cashAtBankCode);
    }

    public Optional<String> otherReceivablesCode() {
        return Optional.ofNullable(otherReceivablesCode);
    }

    public Optional<String> priorYearCashCode() {
        return Optional.ofNullable(priorYearCashCode);
    }

    /**
     * Expenses outside the transfers subcategory that found no payable line
     */
    public List<String> unmappedExpenses() {
        return unmappedExpenses;
    }

    private static String derivePayableCode(Activity expense, Map<String, String> payablesByName) {
        String name = expense.getName().toLowerCase(Locale.ROOT);
        String subCategory = expense.getSubCategoryCode() == null ? "" : expense.getSubCategoryCode();

        switch (subCategory) {
            case "B-01":
                return findPayable(payablesByName, "salaries");
            case "B-02":
                if (name.contains("supervision")) {
                    return findPayable(payablesByName, "supervision");
                }
                if (name.contains("meeting")) {
                    return findPayable(payablesByName, "meetings");
                }
                return null;
            case "B-03":
                if (name.contains("sample") && name.contains("transport")) {
                    return findPayable(payablesByName, "sample transport");
                }
                if (name.contains("home") && name.contains("visit")) {
                    return findPayable(payablesByName, "home visits");
                }
                if (name.contains("travel") && name.contains("survey")) {
                    return findPayable(payablesByName, "travel surveillance", "travel survellance");
                }
                return null;
            case "B-04":
                return deriveOverheadPayable(name, payablesByName);
            default:
                return null;
        }
    }

    private static String deriveOverheadPayable(String name, Map<String, String> payablesByName) {
        if (name.contains("communication") && name.contains("all")) {
            return findPayable(payablesByName, "payable 12", "communication - all", "communication all");
        }
        if (name.contains("maintenance")) {
            return findPayable(payablesByName, "payable 13", "maintenance");
        }
        if (name.equals("fuel") || (name.contains("fuel") && !name.contains("refund"))) {
            return findPayable(payablesByName, "payable 14", "fuel");
        }
        if (name.contains("office") && name.contains("supplies")) {
            return findPayable(payablesByName, "payable 15", "office supplies", "supplies");
        }
        if (name.contains("transport") && name.contains("reporting")) {
            return findPayable(payablesByName, "transport reporting");
        }
        if (name.contains("bank") && name.contains("charges")) {
            return findPayable(payablesByName, "bank charges");
        }
        if (name.contains("car") && name.contains("hiring")) {
            return findPayable(payablesByName, "car hiring");
        }
        if (name.contains("consumable")) {
            return findPayable(payablesByName, "consumable");
        }
        if (name.contains("transport") && name.contains("travel")) {
            return findPayable(payablesByName, "transport", "travel");
        }
        return null;
    }

    /**
     * Exact payable name first, then the first payable whose name contains the pattern
     */
    private static String findPayable(Map<String, String> payablesByName, String... patterns) {
        for (String pattern : patterns) {
            String exact = payablesByName.get(pattern);
            if (exact != null) {
                return exact;
            }
            for (Map.Entry<String, String> entry : payablesByName.entrySet()) {
                if (entry.getKey().contains(pattern)) {
                    return entry.getValue();
                }
            }
        }
        return null;
    }
}
