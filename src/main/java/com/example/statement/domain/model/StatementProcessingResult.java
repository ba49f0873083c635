package com.example.statement.domain.model;

import java.util.List;

/**
 * Domain DTO returned by the processing pipeline for one statement document.
 * Controllers cache it in the session so CSV export can work on the same transactions.
 */
public record StatementProcessingResult(
        String fileName,
        String bankName,
        DetectionSource detectionSource,
        List<CanonicalTransactionRecord> transactions
) {

    public StatementProcessingResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
