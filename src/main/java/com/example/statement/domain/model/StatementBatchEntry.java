package com.example.statement.domain.model;

/**
 * Per-file entry of a batch run.
 *
 * @param fileName         uploaded file name
 * @param status           processing outcome
 * @param bankName         bank used for parsing, {@code null} when the file failed
 * @param detectionSource  how the bank was decided, {@code null} when the file failed
 * @param transactionCount number of transactions extracted
 * @param error            failure message, {@code null} unless {@link BatchFileStatus#FAILED}
 */
public record StatementBatchEntry(
        String fileName,
        BatchFileStatus status,
        String bankName,
        DetectionSource detectionSource,
        int transactionCount,
        String error
) {

    public static StatementBatchEntry processed(StatementProcessingResult result) {
        int count = result.transactions().size();
        BatchFileStatus status = count > 0 ? BatchFileStatus.SUCCESS : BatchFileStatus.NO_DATA;
        return new StatementBatchEntry(result.fileName(), status, result.bankName(), result.detectionSource(), count, null);
    }

    public static StatementBatchEntry failed(String fileName, String error) {
        return new StatementBatchEntry(fileName, BatchFileStatus.FAILED, null, null, 0, error);
    }
}
