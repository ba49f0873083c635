package com.example.statement.application.service;

import com.example.statement.application.exception.CsvExportValidationException;
import com.example.statement.domain.model.CanonicalTransactionRecord;
import com.example.statement.domain.model.DetectionSource;
import com.example.statement.domain.model.RawTransactionRecord;
import com.example.statement.domain.model.StatementProcessingResult;
import com.example.statement.domain.model.TransactionFields;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests verifying the CSV export application service honors validation rules and produces CSV output.
 */
class CsvExportServiceTest {

    private final CsvExportService service = new CsvExportService();
    private final TransactionNormalizer normalizer = new TransactionNormalizer();

    /**
     * Ensures validation fails when no cached result exists in the session.
     */
    @Test
    void exportSelectedRowsRequiresCachedResult() {
        assertThrows(CsvExportValidationException.class, () -> service.exportSelectedRows(null, List.of(1)));
    }

    /**
     * Ensures validation fails when row identifiers are missing.
     */
    @Test
    void exportSelectedRowsRequiresIds() {
        StatementProcessingResult result = sampleResult();

        assertThrows(CsvExportValidationException.class, () -> service.exportSelectedRows(result, null));
        assertThrows(CsvExportValidationException.class, () -> service.exportSelectedRows(result, List.of()));
    }

    @Test
    void exportSelectedRowsRejectsUnknownPositions() {
        StatementProcessingResult result = sampleResult();

        assertThrows(CsvExportValidationException.class, () -> service.exportSelectedRows(result, List.of(0, 3)));
    }

    /**
     * Ensures the service produces CSV content for valid selections.
     */
    @Test
    void exportSelectedRowsReturnsCsv() {
        StatementProcessingResult result = sampleResult();

        String csv = service.exportSelectedRows(result, List.of(2));

        assertThat(csv).startsWith("transaction date,description,transaction amount,income amount,expense amount\n");
        assertThat(csv).contains("2023-05-03,\"Coffee, large\",-30.0,0.0,30.0");
        assertThat(csv).doesNotContain("Salary");
    }

    @Test
    void exportAllWritesEveryRow() {
        String csv = service.exportAll(sampleResult());

        assertThat(csv.lines()).hasSize(3);
        assertThat(csv).contains("2023-05-01,Salary,1250.5,1250.5,0.0");
    }

    /**
     * @return sample processing result used across the test cases
     */
    private StatementProcessingResult sampleResult() {
        List<CanonicalTransactionRecord> transactions = normalizer.standardize(List.of(
                RawTransactionRecord.builder()
                        .put(TransactionFields.TRANSACTION_DATE, "2023/05/01")
                        .put(TransactionFields.DESCRIPTION, "Salary")
                        .put(TransactionFields.TRANSACTION_AMOUNT, "1,250.50")
                        .build(),
                RawTransactionRecord.builder()
                        .put(TransactionFields.TRANSACTION_DATE, "2023/05/03")
                        .put(TransactionFields.DESCRIPTION, "Coffee, large")
                        .put(TransactionFields.TRANSACTION_AMOUNT, "-30")
                        .build()
        ));
        return new StatementProcessingResult("sample.pdf", "other", DetectionSource.FUZZY_MATCH, transactions);
    }
}
