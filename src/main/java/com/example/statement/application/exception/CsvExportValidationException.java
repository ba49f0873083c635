package com.example.statement.application.exception;

/**
 * Thrown when the selected transactions cannot be exported to CSV.
 */
public class CsvExportValidationException extends UseCaseValidationException {

    public CsvExportValidationException(String message) {
        super(message);
    }
}
