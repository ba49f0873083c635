package com.example.statement.infrastructure.exception;

/**
 * Single failure type for a statement that could not be opened or parsed by its bank parser.
 */
public class PdfProcessingException extends InfrastructureException {

	/**
	 * @param message human readable description naming the statement
	 * @param cause   original exception, kept for logs
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
