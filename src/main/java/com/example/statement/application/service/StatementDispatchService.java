package com.example.statement.application.service;

import com.example.statement.application.exception.BankParserConfigurationException;
import com.example.statement.application.parser.BankStatementParser;
import com.example.statement.domain.model.BankParseResult;
import com.example.statement.domain.model.RawTransactionRecord;
import com.example.statement.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Opens a statement and hands it to the bank parser chosen for it.
 * Parser and PDFBox failures leave this service as a single {@link PdfProcessingException}.
 */
@Service
public class StatementDispatchService {

    private static final Logger log = LoggerFactory.getLogger(StatementDispatchService.class);

    /**
     * Runs the parser against the document and returns its primary records.
     *
     * @param documentPath statement on disk
     * @param parser       parser for the statement's bank
     * @return raw records in document order
     * @throws BankParserConfigurationException when no parser is supplied or it returns no result
     * @throws PdfProcessingException           when the document cannot be read or the parser fails
     */
    public List<RawTransactionRecord> processDocument(Path documentPath, BankStatementParser parser) {
        if (parser == null) {
            throw new BankParserConfigurationException("No bank statement parser supplied for " + documentPath);
        }
        String displayName = documentPath == null || documentPath.getFileName() == null
                ? String.valueOf(documentPath) : documentPath.getFileName().toString();

        BankParseResult result;
        try (PDDocument document = Loader.loadPDF(documentPath.toFile())) {
            result = parser.parse(document);
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to process statement {} with {}", documentPath, parser.getClass().getSimpleName(), ex);
            throw new PdfProcessingException("Unable to process statement " + displayName + ": " + describe(ex), ex);
        }

        if (result == null) {
            throw new BankParserConfigurationException(
                    "Parser " + parser.getClass().getName() + " returned no result for " + displayName);
        }
        log.debug("{} returned {} records and {} account type records for {}",
                parser.getClass().getSimpleName(), result.records().size(), result.accountTypeRecords().size(), displayName);
        return result.records();
    }

    private String describe(Exception ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
