package com.example.statement.application.exception;

/**
 * Signals validation issues detected while running a use case, such as an export without a selection.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
