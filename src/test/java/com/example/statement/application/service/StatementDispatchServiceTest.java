package com.example.statement.application.service;

import com.example.statement.application.exception.BankParserConfigurationException;
import com.example.statement.application.parser.BankStatementParser;
import com.example.statement.domain.model.BankParseResult;
import com.example.statement.domain.model.RawTransactionRecord;
import com.example.statement.domain.model.TransactionFields;
import com.example.statement.infrastructure.exception.PdfProcessingException;
import com.example.statement.support.StatementPdfs;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for handing statements to bank parsers.
 */
class StatementDispatchServiceTest {

    @TempDir
    Path tempDir;

    private final StatementDispatchService service = new StatementDispatchService();

    @Test
    void returnsPrimaryRecordsOnly() throws Exception {
        Path pdf = StatementPdfs.write(tempDir.resolve("statement.pdf"), "Hello");
        RawTransactionRecord record = RawTransactionRecord.of(Map.of(TransactionFields.DESCRIPTION, "pages"));
        RawTransactionRecord summary = RawTransactionRecord.of(Map.of(TransactionFields.ACCOUNT_TYPE, "Savings"));
        BankStatementParser parser = new FixedParser(BankParseResult.withAccountTypes(List.of(record), List.of(summary)));

        assertThat(service.processDocument(pdf, parser)).containsExactly(record);
    }

    @Test
    void missingParserIsConfigurationError() throws Exception {
        Path pdf = StatementPdfs.write(tempDir.resolve("statement.pdf"), "Hello");

        assertThrows(BankParserConfigurationException.class, () -> service.processDocument(pdf, null));
    }

    /**
     * A parser that produces nothing is reported with its type name.
     */
    @Test
    void parserReturningNothingIsNamed() throws Exception {
        Path pdf = StatementPdfs.write(tempDir.resolve("statement.pdf"), "Hello");

        BankParserConfigurationException ex = assertThrows(BankParserConfigurationException.class,
                () -> service.processDocument(pdf, new FixedParser(null)));

        assertThat(ex.getMessage()).contains(FixedParser.class.getName());
    }

    @Test
    void parserFailureIsWrapped() throws Exception {
        Path pdf = StatementPdfs.write(tempDir.resolve("statement.pdf"), "Hello");
        List<PDDocument> opened = new ArrayList<>();
        BankStatementParser failing = new FixedParser(null) {
            @Override
            public BankParseResult parse(PDDocument document) throws IOException {
                opened.add(document);
                throw new IOException("table layout changed");
            }
        };

        PdfProcessingException ex = assertThrows(PdfProcessingException.class, () -> service.processDocument(pdf, failing));

        assertThat(ex.getMessage()).contains("statement.pdf").contains("table layout changed");
        assertThat(ex.getCause()).isInstanceOf(IOException.class);
        assertThat(opened).hasSize(1);
        assertThat(opened.get(0).getDocument().isClosed()).isTrue();
    }

    /**
     * The document is released after the parser returns as well as after it fails.
     */
    @Test
    void documentIsClosedAfterParsing() throws Exception {
        Path pdf = StatementPdfs.write(tempDir.resolve("statement.pdf"), "Hello");
        List<PDDocument> opened = new ArrayList<>();
        BankStatementParser capturing = new FixedParser(BankParseResult.of(List.of())) {
            @Override
            public BankParseResult parse(PDDocument document) throws IOException {
                opened.add(document);
                return super.parse(document);
            }
        };
        BankStatementParser runtimeFailure = new FixedParser(null) {
            @Override
            public BankParseResult parse(PDDocument document) {
                opened.add(document);
                throw new IllegalStateException("unexpected column count");
            }
        };

        assertThat(service.processDocument(pdf, capturing)).isEmpty();
        assertThrows(PdfProcessingException.class, () -> service.processDocument(pdf, runtimeFailure));

        assertThat(opened).hasSize(2);
        assertThat(opened).allSatisfy(document -> assertThat(document.getDocument().isClosed()).isTrue());
    }

    @Test
    void unreadableDocumentIsWrapped() throws Exception {
        Path broken = tempDir.resolve("broken.pdf");
        Files.write(broken, "nope".getBytes(StandardCharsets.UTF_8));

        assertThrows(PdfProcessingException.class,
                () -> service.processDocument(broken, new FixedParser(BankParseResult.of(List.of()))));
    }

    private static class FixedParser implements BankStatementParser {

        private final BankParseResult result;

        FixedParser(BankParseResult result) {
            this.result = result;
        }

        @Override
        public String bankName() {
            return "Fixed";
        }

        @Override
        public BankParseResult parse(PDDocument document) throws IOException {
            return result;
        }
    }
}
