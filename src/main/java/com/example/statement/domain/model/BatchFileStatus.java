package com.example.statement.domain.model;

/**
 * Outcome of one statement in a batch run.
 */
public enum BatchFileStatus {
    SUCCESS,
    NO_DATA,
    FAILED
}
