package com.example.statement.domain.exception;

/**
 * Raised when the referenced statement file does not exist on disk.
 */
public class StatementNotFoundException extends DomainException {

	/**
	 * @param path path that could not be resolved
	 */
    public StatementNotFoundException(String path) {
        super("Statement not found: " + path);
    }
}
