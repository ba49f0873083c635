package com.example.statement.infrastructure.exception;

/**
 * Base unchecked exception for failures while reading statement documents.
 * Keeps PDFBox and parser exception types out of the callers' vocabulary.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failure
	 * @param cause   exception raised by the underlying library or parser
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
