package com.example.statement.application.service;

import com.example.statement.domain.model.BankDetectionResult;
import com.example.statement.domain.model.BankKeywordTable;
import com.example.statement.domain.model.DetectionSource;
import com.example.statement.domain.model.PageTextExtraction;
import com.example.statement.infrastructure.config.StatementProperties;
import com.example.statement.infrastructure.pdf.PdfBoxTextExtractor;

import me.xdrop.fuzzywuzzy.FuzzySearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Application-layer service that decides which bank issued a statement.
 * Looks at the first pages of the document, then falls back to the file name.
 */
@Service
public class BankDetectionService {

    private static final Logger log = LoggerFactory.getLogger(BankDetectionService.class);

    private final PdfBoxTextExtractor textExtractor;
    private final BankKeywordTable defaultKeywords;
    private final BankKeywordTable configuredOverrides;
    private final StatementProperties.Detection settings;

    /**
     * Creates the service with its collaborators and the keyword tables built at startup.
     *
     * @param textExtractor       reads the leading pages of a statement
     * @param defaultKeywords     built-in keyword table
     * @param configuredOverrides overrides from configuration, used when a call supplies none
     * @param properties          detection settings
     */
    public BankDetectionService(PdfBoxTextExtractor textExtractor,
                                @Qualifier("defaultBankKeywords") BankKeywordTable defaultKeywords,
                                @Qualifier("bankKeywordOverrides") BankKeywordTable configuredOverrides,
                                StatementProperties properties) {
        this.textExtractor = textExtractor;
        this.defaultKeywords = defaultKeywords;
        this.configuredOverrides = configuredOverrides;
        this.settings = properties.getDetection();
    }

    /**
     * Identifies the bank using the configured overrides.
     *
     * @param documentPath statement on disk
     * @return bank name, {@link BankDetectionResult#UNKNOWN_BANK} when nothing matched
     */
    public String detectBank(Path documentPath) {
        return detectBank(documentPath, null);
    }

    /**
     * Identifies the bank of a statement.
     *
     * @param documentPath statement on disk
     * @param overrides    keywords checked before the built-in table, {@code null} to use the configured ones
     * @return bank name, {@link BankDetectionResult#UNKNOWN_BANK} when nothing matched or the file is unreadable
     */
    public String detectBank(Path documentPath, BankKeywordTable overrides) {
        String fileName = documentPath == null || documentPath.getFileName() == null
                ? "" : documentPath.getFileName().toString();
        return identify(documentPath, fileName, overrides).bankName();
    }

    /**
     * Identifies the bank and reports which step decided it.
     *
     * @param documentPath statement on disk
     * @param fileName     name used for the file-name fallback (uploads are staged under temp names)
     * @param overrides    keywords checked first, {@code null} to use the configured ones
     * @return detection result; never {@code null}
     */
    public BankDetectionResult identify(Path documentPath, String fileName, BankKeywordTable overrides) {
        PageTextExtraction extraction = textExtractor.extractText(documentPath, settings.getPageBudget(), null);
        if (!extraction.succeeded()) {
            log.warn("Bank detection could not read {}: {}", fileName, extraction.failureReason());
            return BankDetectionResult.unknown(DetectionSource.EXTRACTION_FAILED, 0);
        }
        return identifyText(extraction.text(), fileName, overrides);
    }

    /**
     * Identifies the bank from text that has already been extracted.
     *
     * @param text      statement text, may be empty
     * @param fileName  statement file name, may be {@code null}
     * @param overrides keywords checked first, {@code null} to use the configured ones
     * @return detection result; never {@code null}
     */
    public BankDetectionResult identifyText(String text, String fileName, BankKeywordTable overrides) {
        String haystack = text == null ? "" : text.toLowerCase(Locale.ROOT);
        BankKeywordTable effectiveOverrides = overrides != null ? overrides : configuredOverrides;

        String overrideBank = firstSubstringMatch(effectiveOverrides, haystack);
        if (overrideBank != null) {
            log.debug("Override keyword matched bank {} in {}", overrideBank, fileName);
            return new BankDetectionResult(overrideBank, DetectionSource.OVERRIDE_KEYWORD, 0);
        }

        String bestBank = null;
        int bestScore = 0;
        for (Map.Entry<String, List<String>> entry : defaultKeywords.asMap().entrySet()) {
            for (String keyword : entry.getValue()) {
                String needle = keyword.toLowerCase(Locale.ROOT);
                if (haystack.contains(needle)) {
                    log.debug("Keyword '{}' matched bank {} in {}", keyword, entry.getKey(), fileName);
                    return new BankDetectionResult(entry.getKey(), DetectionSource.DEFAULT_KEYWORD, bestScore);
                }
                int score = fuzzyScore(needle, haystack);
                if (score > bestScore) {
                    bestScore = score;
                    bestBank = entry.getKey();
                }
            }
        }

        if (bestBank != null && acceptsFuzzyScore(bestScore)) {
            log.debug("Fuzzy match chose bank {} with score {} (threshold {}) for {}",
                    bestBank, bestScore, settings.getFuzzyThreshold(), fileName);
            return new BankDetectionResult(bestBank, DetectionSource.FUZZY_MATCH, bestScore);
        }

        String lowerFileName = fileName == null ? "" : baseName(fileName).toLowerCase(Locale.ROOT);
        String fileNameBank = firstSubstringMatch(defaultKeywords, lowerFileName);
        if (fileNameBank != null) {
            log.debug("File name {} matched bank {}", fileName, fileNameBank);
            return new BankDetectionResult(fileNameBank, DetectionSource.FILE_NAME, bestScore);
        }

        log.info("No bank identified for {}", fileName);
        return BankDetectionResult.unknown(DetectionSource.NO_MATCH, bestScore);
    }

    /**
     * Without enforcement every positive score wins; the threshold only applies when enabled.
     */
    private boolean acceptsFuzzyScore(int score) {
        if (settings.isEnforceFuzzyThreshold()) {
            return score > settings.getFuzzyThreshold();
        }
        return score > 0;
    }

    private int fuzzyScore(String keyword, String text) {
        if (text.isBlank()) {
            return 0;
        }
        return FuzzySearch.partialRatio(keyword, text);
    }

    private String firstSubstringMatch(BankKeywordTable table, String lowerText) {
        if (table == null || lowerText.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, List<String>> entry : table.asMap().entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lowerText.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    private String baseName(String fileName) {
        int separator = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        return separator >= 0 ? fileName.substring(separator + 1) : fileName;
    }
}
