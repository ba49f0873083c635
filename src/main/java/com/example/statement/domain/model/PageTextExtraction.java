package com.example.statement.domain.model;

/**
 * Text pulled from a subset of a PDF's pages.
 * A failed extraction carries no text and a human readable reason instead of an exception.
 *
 * @param text          concatenated page text, {@code null} when extraction failed
 * @param pageCount     total pages in the document, {@code 0} when it could not be opened
 * @param pagesRead     number of pages that were selected for extraction
 * @param failureReason cause of the failure, {@code null} on success
 */
public record PageTextExtraction(
        String text,
        int pageCount,
        int pagesRead,
        String failureReason
) {

    public static PageTextExtraction success(String text, int pageCount, int pagesRead) {
        return new PageTextExtraction(text, pageCount, pagesRead, null);
    }

    public static PageTextExtraction failed(String failureReason) {
        return new PageTextExtraction(null, 0, 0, failureReason);
    }

    public boolean succeeded() {
        return failureReason == null;
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
