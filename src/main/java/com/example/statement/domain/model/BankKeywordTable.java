package com.example.statement.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, ordered mapping from bank name to the keywords that identify its statements.
 * Iteration order is the matching priority: the first bank whose keyword hits wins.
 */
public final class BankKeywordTable {

    private static final BankKeywordTable EMPTY = new BankKeywordTable(Map.of());

    private final Map<String, List<String>> keywordsByBank;

    private BankKeywordTable(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((bank, keywords) -> {
            if (bank == null || bank.isBlank()) {
                throw new IllegalArgumentException("Bank name must not be blank.");
            }
            List<String> cleaned = new ArrayList<>();
            if (keywords != null) {
                for (String keyword : keywords) {
                    if (keyword != null && !keyword.isBlank()) {
                        cleaned.add(keyword);
                    }
                }
            }
            if (cleaned.isEmpty()) {
                throw new IllegalArgumentException("Bank '" + bank + "' needs at least one non-blank keyword.");
            }
            copy.put(bank, Collections.unmodifiableList(cleaned));
        });
        this.keywordsByBank = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a table preserving the iteration order of the given map.
     *
     * @param keywordsByBank bank name to keyword list, ordered by priority
     * @return immutable table
     * @throws IllegalArgumentException when a bank has a blank name or no usable keyword
     */
    public static BankKeywordTable of(Map<String, List<String>> keywordsByBank) {
        if (keywordsByBank == null || keywordsByBank.isEmpty()) {
            return EMPTY;
        }
        return new BankKeywordTable(keywordsByBank);
    }

    public static BankKeywordTable empty() {
        return EMPTY;
    }

    /**
     * Built-in keyword table used when no caller override matches.
     * Some banks share English keywords; the earlier entry takes priority.
     *
     * @return default table
     */
    public static BankKeywordTable builtInDefaults() {
        Map<String, List<String>> defaults = new LinkedHashMap<>();
        defaults.put("E.SUN Bank", List.of("玉山银行", "玉山", "E.SUN", "E. SUN", "E.SUN Bank", "E. SUN BANK",
                "E.SUN Commercial Bank", "E. SUN COMMERCIAL BANK", "ESUN", "ESUNHKHH", "玉山銀行"));
        defaults.put("Standard Chartered", List.of("渣打", "SDB", "Shanghaidi Bank"));
        defaults.put("HSBC", List.of("中国汇丰银行", "汇丰", "HSBC", "HongKong and Shanghai Banking Corporation"));
        defaults.put("Nanyang Commercial Bank", List.of("中国南洋银行", "南洋", "NBC", "National Bank of China"));
        defaults.put("Hang Seng Bank", List.of("中国恒生银行", "恒生", "HSBC", "HongKong and Shanghai Banking Corporation"));
        defaults.put("BOC Hong Kong", List.of("中国中银香港", "中银", "HSBC", "HongKong and Shanghai Banking Corporation"));
        defaults.put("Bank of East Asia", List.of("东亚银行", "东亚", "Eastern Asia Bank"));
        return new BankKeywordTable(defaults);
    }

    public boolean isEmpty() {
        return keywordsByBank.isEmpty();
    }

    public List<String> banks() {
        return List.copyOf(keywordsByBank.keySet());
    }

    public List<String> keywordsFor(String bank) {
        return keywordsByBank.getOrDefault(bank, List.of());
    }

    /**
     * @return read-only view in priority order
     */
    public Map<String, List<String>> asMap() {
        return keywordsByBank;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BankKeywordTable table)) {
            return false;
        }
        return keywordsByBank.equals(table.keywordsByBank)
                && List.copyOf(keywordsByBank.keySet()).equals(List.copyOf(table.keywordsByBank.keySet()));
    }

    @Override
    public int hashCode() {
        return keywordsByBank.hashCode();
    }

    @Override
    public String toString() {
        return "BankKeywordTable" + keywordsByBank;
    }
}
