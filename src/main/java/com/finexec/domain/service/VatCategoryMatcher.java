package com.finexec.domain.service;

import com.finexec.domain.model.VatCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Name-pattern detection of VAT categories.
 * Used only to backfill catalogs that do not carry an explicit vatCategory.
 * Patterns are checked most specific first.
 */
public final class VatCategoryMatcher {

    private VatCategoryMatcher() {
    }

    public static Optional<VatCategory> match(String expenseName) {
        List<VatCategory> matches = allMatches(expenseName);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * Every category whose pattern matches, in matching order
     */
    public static List<VatCategory> allMatches(String expenseName) {
        List<VatCategory> matches = new ArrayList<>();
        if (expenseName == null) {
            return matches;
        }
        String name = expenseName.toLowerCase(Locale.ROOT).trim();
        if (name.contains("communication") && name.contains("all")) {
            matches.add(VatCategory.COMMUNICATION_ALL);
        }
        if (name.contains("maintenance")) {
            matches.add(VatCategory.MAINTENANCE);
        }
        if (name.equals("fuel") || (name.contains("fuel") && !name.contains("refund"))) {
            matches.add(VatCategory.FUEL);
        }
        if (name.contains("office supplies") || (name.contains("supplies") && !name.contains("consumable"))) {
            matches.add(VatCategory.OFFICE_SUPPLIES);
        }
        return matches;
    }

    public static boolean isAmbiguous(String expenseName) {
        return allMatches(expenseName).size() > 1;
    }
}
