package com.example.statement.application.service;

import com.example.statement.application.exception.ApplicationException;
import com.example.statement.application.exception.UseCaseValidationException;
import com.example.statement.application.parser.BankParserRegistry;
import com.example.statement.application.parser.BankStatementParser;
import com.example.statement.domain.exception.DomainException;
import com.example.statement.domain.exception.StatementFileRequiredException;
import com.example.statement.domain.exception.StatementNotFoundException;
import com.example.statement.domain.exception.StatementPathRequiredException;
import com.example.statement.domain.exception.UnsupportedStatementFormatException;
import com.example.statement.domain.model.BankDetectionResult;
import com.example.statement.domain.model.CanonicalTransactionRecord;
import com.example.statement.domain.model.DetectionSource;
import com.example.statement.domain.model.RawTransactionRecord;
import com.example.statement.domain.model.StatementBatchEntry;
import com.example.statement.domain.model.StatementBatchResult;
import com.example.statement.domain.model.StatementDetectionEntry;
import com.example.statement.domain.model.StatementProcessingResult;
import com.example.statement.domain.model.TransactionFields;
import com.example.statement.infrastructure.exception.InfrastructureException;
import com.example.statement.infrastructure.exception.PdfProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that runs a statement through the whole pipeline:
 * bank detection, parser resolution, record extraction and normalization.
 */
@Service
public class StatementProcessingService {

    private static final Logger log = LoggerFactory.getLogger(StatementProcessingService.class);

    private final BankDetectionService bankDetectionService;
    private final BankParserRegistry parserRegistry;
    private final StatementDispatchService dispatchService;
    private final TransactionNormalizer normalizer;

    public StatementProcessingService(BankDetectionService bankDetectionService,
                                      BankParserRegistry parserRegistry,
                                      StatementDispatchService dispatchService,
                                      TransactionNormalizer normalizer) {
        this.bankDetectionService = bankDetectionService;
        this.parserRegistry = parserRegistry;
        this.dispatchService = dispatchService;
        this.normalizer = normalizer;
    }

    /**
     * Processes a statement on disk, detecting its bank.
     *
     * @param statementPath statement PDF
     * @return normalized transactions
     */
    public StatementProcessingResult process(Path statementPath) {
        return process(statementPath, null);
    }

    /**
     * Processes a statement on disk.
     *
     * @param statementPath statement PDF
     * @param bankOverride  bank whose parser to use, {@code null} or blank to detect it
     * @return normalized transactions
     * @throws StatementPathRequiredException when {@code statementPath} is null
     * @throws StatementNotFoundException     when the path does not exist
     */
    public StatementProcessingResult process(Path statementPath, String bankOverride) {
        requireExisting(statementPath);
        return processInternal(statementPath, statementPath.getFileName().toString(), bankOverride);
    }

    /**
     * Processes an uploaded statement. The upload is staged in a temporary file for the duration of the call.
     *
     * @param file         uploaded PDF
     * @param bankOverride bank whose parser to use, {@code null} or blank to detect it
     * @return normalized transactions
     * @throws StatementFileRequiredException      when the file is missing or empty
     * @throws UnsupportedStatementFormatException when the upload does not look like a PDF
     * @throws PdfProcessingException              when the upload cannot be staged or parsed
     */
    public StatementProcessingResult process(MultipartFile file, String bankOverride) {
        validateUpload(file);
        String fileName = resolveFileName(file);
        Path staged = stage(file);
        try {
            return processInternal(staged, fileName, bankOverride);
        } finally {
            discard(staged);
        }
    }

    /**
     * Processes several uploads one after another. A file that cannot be processed is recorded as failed
     * and the remaining files are still processed.
     *
     * @param files        uploaded PDFs
     * @param bankOverride bank whose parser to use for every file, {@code null} or blank to detect per file
     * @return per-file status, summary and the combined transactions
     * @throws UseCaseValidationException when no file was uploaded
     */
    public StatementBatchResult processBatch(List<MultipartFile> files, String bankOverride) {
        requireBatch(files);
        List<StatementBatchEntry> entries = new ArrayList<>(files.size());
        List<StatementProcessingResult> results = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            String fileName = displayName(file);
            try {
                StatementProcessingResult result = process(file, bankOverride);
                results.add(result);
                entries.add(StatementBatchEntry.processed(result));
            } catch (DomainException | ApplicationException | InfrastructureException ex) {
                log.warn("Statement {} failed: {}", fileName, ex.getMessage());
                entries.add(StatementBatchEntry.failed(fileName, ex.getMessage()));
            }
        }

        StatementBatchResult batch = StatementBatchResult.of(entries, results);
        log.info("Batch finished: {} files, {} with transactions, {} without, {} failed, {} transactions",
                entries.size(), batch.succeeded(), batch.noData(), batch.failed(), batch.totalTransactions());
        return batch;
    }

    /**
     * Identifies the bank of every upload. Rejected files are reported as unknown with the reason.
     *
     * @param files uploaded PDFs
     * @return one entry per file, in upload order
     * @throws UseCaseValidationException when no file was uploaded
     */
    public List<StatementDetectionEntry> detectBatch(List<MultipartFile> files) {
        requireBatch(files);
        List<StatementDetectionEntry> entries = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            String fileName = displayName(file);
            try {
                entries.add(new StatementDetectionEntry(fileName, detect(file), null));
            } catch (DomainException | InfrastructureException ex) {
                log.warn("Bank detection skipped {}: {}", fileName, ex.getMessage());
                entries.add(new StatementDetectionEntry(fileName,
                        BankDetectionResult.unknown(DetectionSource.EXTRACTION_FAILED, 0), ex.getMessage()));
            }
        }
        return entries;
    }

    /**
     * Identifies the bank of an uploaded statement without parsing it.
     *
     * @param file uploaded PDF
     * @return detection result
     */
    public BankDetectionResult detect(MultipartFile file) {
        validateUpload(file);
        String fileName = resolveFileName(file);
        Path staged = stage(file);
        try {
            return bankDetectionService.identify(staged, fileName, null);
        } finally {
            discard(staged);
        }
    }

    /**
     * Identifies the bank of a statement on disk.
     *
     * @param statementPath statement PDF
     * @return detection result
     */
    public BankDetectionResult detect(Path statementPath) {
        requireExisting(statementPath);
        return bankDetectionService.identify(statementPath, statementPath.getFileName().toString(), null);
    }

    public List<String> supportedBanks() {
        return parserRegistry.supportedBanks();
    }

    private StatementProcessingResult processInternal(Path statementPath, String fileName, String bankOverride) {
        String bankName;
        DetectionSource source;
        BankStatementParser parser;
        if (bankOverride != null && !bankOverride.isBlank()) {
            bankName = bankOverride.trim();
            source = DetectionSource.CALLER_SELECTED;
            parser = parserRegistry.resolve(bankName);
        } else {
            BankDetectionResult detection = bankDetectionService.identify(statementPath, fileName, null);
            bankName = detection.bankName();
            source = detection.source();
            parser = parserRegistry.resolveOrGeneric(bankName);
        }

        List<RawTransactionRecord> tagged = dispatchService.processDocument(statementPath, parser).stream()
                .map(record -> record
                        .with(TransactionFields.BANK, bankName)
                        .with(TransactionFields.FILE_NAME, fileName))
                .toList();
        List<CanonicalTransactionRecord> transactions = normalizer.standardize(tagged);

        log.info("Processed {} as {} ({}): {} transactions", fileName, bankName, source, transactions.size());
        return new StatementProcessingResult(fileName, bankName, source, transactions);
    }

    private void requireExisting(Path statementPath) {
        if (statementPath == null) {
            throw new StatementPathRequiredException();
        }
        if (!Files.exists(statementPath)) {
            throw new StatementNotFoundException(statementPath.toAbsolutePath().toString());
        }
    }

    private void requireBatch(List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new UseCaseValidationException("Please choose at least one bank statement PDF to process.");
        }
    }

    private String displayName(MultipartFile file) {
        return file == null ? null : resolveFileName(file);
    }

    private void validateUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StatementFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedStatementFormatException(file.getOriginalFilename());
        }
    }

    private Path stage(MultipartFile file) {
        try {
            Path staged = Files.createTempFile("statement-", ".pdf");
            file.transferTo(staged);
            return staged;
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to store the uploaded statement.", e);
        }
    }

    private void discard(Path staged) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warn("Could not delete staged statement {}", staged, e);
        }
    }

    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "statement.pdf";
        }
        return fileName;
    }
}
