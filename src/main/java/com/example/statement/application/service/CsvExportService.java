package com.example.statement.application.service;

import com.example.statement.application.exception.CsvExportValidationException;
import com.example.statement.domain.model.CanonicalTransactionRecord;
import com.example.statement.domain.model.StatementProcessingResult;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Application-layer service that turns normalized transactions into downloadable CSV content.
 */
@Service
public class CsvExportService {

	/**
	 * Runs validation and returns a CSV string containing the requested transactions.
	 *
	 * @param result cached processing result
	 * @param rowIds 1-based positions of the transactions to export
	 * @return CSV content
	 * @throws CsvExportValidationException when there is nothing to export or nothing was selected
	 */
    public String exportSelectedRows(StatementProcessingResult result, List<Integer> rowIds) {
        if (result == null || result.transactions().isEmpty()) {
            throw new CsvExportValidationException("No processed transactions available for export.");
        }
        if (rowIds == null || rowIds.isEmpty()) {
            throw new CsvExportValidationException("Please select at least one transaction before exporting.");
        }

        List<CanonicalTransactionRecord> transactions = result.transactions();
        List<CanonicalTransactionRecord> selected = new ArrayList<>();
        for (int position = 1; position <= transactions.size(); position++) {
            if (rowIds.contains(position)) {
                selected.add(transactions.get(position - 1));
            }
        }
        if (selected.isEmpty()) {
            throw new CsvExportValidationException("Selected transactions were not found.");
        }
        return buildCsv(selected);
    }

	/**
	 * Exports every transaction of the result.
	 *
	 * @param result processing result
	 * @return CSV content
	 */
    public String exportAll(StatementProcessingResult result) {
        if (result == null || result.transactions().isEmpty()) {
            throw new CsvExportValidationException("No processed transactions available for export.");
        }
        return buildCsv(result.transactions());
    }

	/**
	 * Header is the union of field names in first-seen order; missing fields are left empty.
	 */
    private String buildCsv(List<CanonicalTransactionRecord> transactions) {
        Set<String> columns = new LinkedHashSet<>();
        transactions.forEach(transaction -> columns.addAll(transaction.fields().keySet()));

        StringBuilder builder = new StringBuilder();
        builder.append(String.join(",", columns.stream().map(this::escape).toList())).append('\n');
        for (CanonicalTransactionRecord transaction : transactions) {
            List<String> cells = new ArrayList<>(columns.size());
            for (String column : columns) {
                cells.add(escape(format(transaction.value(column))));
            }
            builder.append(String.join(",", cells)).append('\n');
        }
        return builder.toString();
    }

    private String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double amount && Double.isFinite(amount)) {
            return BigDecimal.valueOf(amount).toPlainString();
        }
        return value.toString();
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
