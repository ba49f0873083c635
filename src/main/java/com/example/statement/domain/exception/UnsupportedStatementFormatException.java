package com.example.statement.domain.exception;

/**
 * Raised when an uploaded statement does not look like a PDF.
 * Only page-text-extractable PDF statements are supported.
 */
public class UnsupportedStatementFormatException extends DomainException {

	/**
	 * @param fileName original file name supplied by the client, may be {@code null}
	 */
    public UnsupportedStatementFormatException(String fileName) {
        super("Only PDF bank statements are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
