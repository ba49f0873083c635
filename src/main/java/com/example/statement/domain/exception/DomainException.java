package com.example.statement.domain.exception;

/**
 * Base type for input problems detected before a statement is read.
 * Subclasses describe what the caller got wrong without referring to PDFBox or HTTP.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message explanation suitable for the caller
	 */
    protected DomainException(String message) {
        super(message);
    }
}
