package com.example.statement.domain.model;

/**
 * Outcome of bank identification for a single statement.
 *
 * @param bankName   identified bank, or {@link #UNKNOWN_BANK}
 * @param source     identification step that produced the answer
 * @param fuzzyScore best partial-match score seen against the built-in table (0-100)
 */
public record BankDetectionResult(
        String bankName,
        DetectionSource source,
        int fuzzyScore
) {

    public static final String UNKNOWN_BANK = "unknown";

    public static BankDetectionResult unknown(DetectionSource source, int fuzzyScore) {
        return new BankDetectionResult(UNKNOWN_BANK, source, fuzzyScore);
    }

    public boolean isUnknown() {
        return UNKNOWN_BANK.equals(bankName);
    }
}
