package com.example.statement.domain.exception;

/**
 * Raised when a statement is submitted for processing without a {@link java.nio.file.Path}.
 */
public class StatementPathRequiredException extends DomainException {

    public StatementPathRequiredException() {
        super("Statement path is required.");
    }
}
