package com.example.statement.domain.model;

/**
 * Bank detection outcome for one file of a batch.
 *
 * @param fileName  uploaded file name
 * @param detection detection result; unknown with {@link DetectionSource#EXTRACTION_FAILED} when the file was rejected
 * @param error     reason the file was rejected, {@code null} otherwise
 */
public record StatementDetectionEntry(
        String fileName,
        BankDetectionResult detection,
        String error
) {
}
