package com.example.statement.domain.model;

/**
 * Which identification step decided the bank of a statement.
 * Lets callers tell "could not read the document" apart from "read fine, nothing matched".
 */
public enum DetectionSource {
    CALLER_SELECTED,
    OVERRIDE_KEYWORD,
    DEFAULT_KEYWORD,
    FUZZY_MATCH,
    FILE_NAME,
    NO_MATCH,
    EXTRACTION_FAILED;

    public boolean identified() {
        return this != NO_MATCH && this != EXTRACTION_FAILED;
    }
}
