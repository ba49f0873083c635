package com.example.statement.application.parser;

import com.example.statement.domain.model.BankParseResult;

import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;

/**
 * Bank-specific record extractor. Implementations are Spring beans picked up by {@link BankParserRegistry}.
 */
public interface BankStatementParser {

    /**
     * @return bank name this parser handles, matching the names produced by bank detection
     */
    String bankName();

    /**
     * Extracts raw transaction records from an open statement. The caller owns and closes the document.
     *
     * @param document opened statement
     * @return parsed records, never {@code null}
     * @throws IOException when the document content cannot be read
     */
    BankParseResult parse(PDDocument document) throws IOException;
}
