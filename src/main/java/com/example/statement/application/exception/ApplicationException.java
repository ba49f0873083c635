package com.example.statement.application.exception;

/**
 * Base unchecked exception for failures raised by application services.
 * Subclasses signal problems with the request or the wiring of parsers, never raw I/O errors.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message human readable error description
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
