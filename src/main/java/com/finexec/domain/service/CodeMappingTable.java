package com.finexec.domain.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alias table between legacy or schema activity codes and the canonical storage codes.
 * Resolution is a longest-suffix match; unknown codes resolve to themselves.
 */
public final class CodeMappingTable {

    private static final CodeMappingTable DEFAULT = new CodeMappingTable(defaultAliases());

    private final Map<String, String> aliases;

    public CodeMappingTable(Map<String, String> aliases) {
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    public static CodeMappingTable defaultTable() {
        return DEFAULT;
    }

    private static Map<String, String> defaultAliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        // Schema codes of the D-01 receivables subcategory
        aliases.put("_D_D-01_1", "_D_VAT_COMMUNICATION_ALL");
        aliases.put("_D_D-01_2", "_D_VAT_MAINTENANCE");
        aliases.put("_D_D-01_3", "_D_VAT_FUEL");
        aliases.put("_D_D-01_4", "_D_VAT_SUPPLIES");
        // Per-utility VAT codes from before the four-category split
        aliases.put("_D_VAT_AIRTIME", "_D_VAT_COMMUNICATION_ALL");
        aliases.put("_D_VAT_INTERNET", "_D_VAT_COMMUNICATION_ALL");
        aliases.put("_D_VAT_INFRASTRUCTURE", "_D_VAT_MAINTENANCE");
        // Flat Section D numbering used by the oldest snapshots
        aliases.put("_D_4", "_D_VAT_COMMUNICATION_ALL");
        aliases.put("_D_5", "_D_VAT_COMMUNICATION_ALL");
        aliases.put("_D_6", "_D_VAT_MAINTENANCE");
        aliases.put("_D_7", "_D_VAT_SUPPLIES");
        // Section G has none: _G_1 is the accumulated surplus, not the G-01 cash adjustment
        return aliases;
    }

    public String resolve(String code) {
        if (code == null) {
            return null;
        }
        String bestAlias = null;
        for (String alias : aliases.keySet()) {
            if (code.endsWith(alias) && (bestAlias == null || alias.length() > bestAlias.length())) {
                bestAlias = alias;
            }
        }
        if (bestAlias == null) {
            return code;
        }
        return code.substring(0, code.length() - bestAlias.length()) + aliases.get(bestAlias);
    }

    public boolean isAlias(String code) {
        return code != null && !code.equals(resolve(code));
    }

    /**
     * Legacy forms that resolve to the given canonical code
     */
    public List<String> aliasesOf(String canonicalCode) {
        List<String> result = new ArrayList<>();
        if (canonicalCode == null) {
            return result;
        }
        for (Map.Entry<String, String> entry : aliases.entrySet()) {
            String target = entry.getValue();
            if (canonicalCode.endsWith(target)) {
                String prefix = canonicalCode.substring(0, canonicalCode.length() - target.length());
                String alias = prefix + entry.getKey();
                if (canonicalCode.equals(resolve(alias))) {
                    result.add(alias);
                }
            }
        }
        return result;
    }
}
