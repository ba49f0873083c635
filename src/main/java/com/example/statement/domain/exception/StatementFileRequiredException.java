package com.example.statement.domain.exception;

/**
 * Raised when an upload arrives without a file or with an empty one.
 */
public class StatementFileRequiredException extends DomainException {

    public StatementFileRequiredException() {
        super("Please choose a bank statement PDF to upload.");
    }
}
