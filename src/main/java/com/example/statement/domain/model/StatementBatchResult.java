package com.example.statement.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of processing several statements in one call: a status per file, a summary,
 * and the transactions of every file that produced any.
 *
 * @param files             per-file entries in upload order
 * @param succeeded         files with at least one transaction
 * @param noData            files that parsed but yielded nothing
 * @param failed            files that could not be processed
 * @param totalTransactions transactions across all files
 * @param transactions      transactions of all files, in upload order
 */
public record StatementBatchResult(
        List<StatementBatchEntry> files,
        int succeeded,
        int noData,
        int failed,
        int totalTransactions,
        @JsonIgnore List<CanonicalTransactionRecord> transactions
) {

    static final String BATCH_FILE_NAME = "batch";

    public StatementBatchResult {
        files = List.copyOf(files);
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    /**
     * Builds the summary from the processed files.
     *
     * @param entries per-file entries
     * @param results results of the files that were processed, failed files excluded
     * @return batch result
     */
    public static StatementBatchResult of(List<StatementBatchEntry> entries, List<StatementProcessingResult> results) {
        int succeeded = 0;
        int noData = 0;
        int failed = 0;
        for (StatementBatchEntry entry : entries) {
            if (entry.status() == BatchFileStatus.SUCCESS) {
                succeeded++;
            } else if (entry.status() == BatchFileStatus.NO_DATA) {
                noData++;
            } else {
                failed++;
            }
        }
        List<CanonicalTransactionRecord> transactions = new ArrayList<>();
        results.forEach(result -> transactions.addAll(result.transactions()));
        return new StatementBatchResult(entries, succeeded, noData, failed, transactions.size(), transactions);
    }

    /**
     * Merges every file's transactions into one result so they can be exported together.
     * Each transaction keeps its own {@code bank} and {@code file name} fields.
     *
     * @return combined result
     */
    public StatementProcessingResult combined() {
        return new StatementProcessingResult(BATCH_FILE_NAME, null, null, transactions);
    }
}
