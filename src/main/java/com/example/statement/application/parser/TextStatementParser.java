package com.example.statement.application.parser;

import com.example.statement.domain.model.BankParseResult;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Base for parsers that work line by line on the statement text rather than on page geometry.
 */
public abstract class TextStatementParser implements BankStatementParser {

    /**
     * Amount with two decimals and optional thousands separators, e.g. {@code 1,250.50} or {@code -300.00}.
     */
    protected static final String AMOUNT = "[-+]?(?:\\d{1,3}(?:,\\d{3})+|\\d+)\\.\\d{2}";

    @Override
    public BankParseResult parse(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setLineSeparator("\n");
        stripper.setSortByPosition(true);
        return parseText(stripper.getText(document));
    }

    /**
     * Parses the full statement text.
     *
     * @param text text of every page, lines separated by {@code \n}
     * @return parsed records
     */
    protected abstract BankParseResult parseText(String text);

    /**
     * Splits text into trimmed, non-empty lines with PDF-specific whitespace and minus signs normalized.
     */
    protected static List<String> lines(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return text.replace('\u00A0', ' ')
                .replace('\u2212', '-')
                .replace('\u2013', '-')
                .lines()
                .map(line -> line.replaceAll("\\s+", " ").trim())
                .filter(line -> !line.isEmpty())
                .toList();
    }

    /**
     * @param amount amount token matched by {@link #AMOUNT}
     * @return numeric value, {@code null} when the token is not a number
     */
    protected static BigDecimal toDecimal(String amount) {
        if (amount == null) {
            return null;
        }
        try {
            return new BigDecimal(amount.replace(",", "").replace("+", ""));
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
